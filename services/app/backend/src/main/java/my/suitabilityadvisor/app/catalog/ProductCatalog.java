package my.suitabilityadvisor.app.catalog;

import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.Product;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ProductCatalog {
	private final List<Product> products;
	private final Map<String, Product> byId;

	public ProductCatalog(List<Product> products) {
		Map<String, Product> index = new LinkedHashMap<>();
		for (Product product : products == null ? List.<Product>of() : products) {
			if (index.putIfAbsent(product.id(), product) != null) {
				throw new IllegalStateException("Duplicate product id in catalog: " + product.id());
			}
		}
		this.products = List.copyOf(index.values());
		this.byId = Map.copyOf(index);
	}

	public List<Product> all() {
		return products;
	}

	public List<Product> productsFor(CustomerKind kind) {
		return products.stream()
				.filter(product -> product.targets(kind))
				.toList();
	}

	public Optional<Product> find(String productId) {
		if (productId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(byId.get(productId));
	}

	public int size() {
		return products.size();
	}
}
