package my.suitabilityadvisor.app.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.rules.ProductValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads product definitions from snake_case JSON. Used for the static catalog at start-up and for
 * parsing generated product drafts.
 */
public class ProductCatalogLoader {
	private static final Logger logger = LoggerFactory.getLogger(ProductCatalogLoader.class);
	public static final String DEFAULT_LOCATION = "classpath:catalog/products.json";

	private final ObjectMapper jsonMapper;
	private final ProductValidator validator;

	public ProductCatalogLoader() {
		this(new ProductValidator());
	}

	public ProductCatalogLoader(ProductValidator validator) {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
		this.validator = validator;
	}

	public ProductCatalog load(ResourceLoader resourceLoader, String location) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new IllegalStateException("Product catalog resource not found: " + location);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			ProductCatalog catalog = load(inputStream);
			logger.info("Loaded product catalog ({} products) from {}", catalog.size(), location);
			return catalog;
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to read product catalog from " + location, ex);
		}
	}

	public ProductCatalog load(InputStream inputStream) throws IOException {
		List<Product> products = jsonMapper.readValue(inputStream, new TypeReference<List<Product>>() {
		});
		List<String> errors = new ArrayList<>();
		for (Product product : products) {
			for (String error : validator.validate(product)) {
				errors.add((product == null ? "<null>" : product.id()) + ": " + error);
			}
		}
		if (!errors.isEmpty()) {
			throw new IllegalStateException("Product catalog invalid: " + String.join("; ", errors));
		}
		return new ProductCatalog(products);
	}

	public Product parseProduct(String json) throws IOException {
		return jsonMapper.readValue(json, Product.class);
	}

	public List<String> validate(Product product) {
		return validator.validate(product);
	}
}
