package my.suitabilityadvisor.app.service;

import my.suitabilityadvisor.app.catalog.ProductCatalog;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.dto.ProductDraftResponseDto;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@Service
public class ProductService {
	private final ProductCatalog catalog;
	private final ProductDraftGenerator draftGenerator;

	public ProductService(ProductCatalog catalog, ProductDraftGenerator draftGenerator) {
		this.catalog = catalog;
		this.draftGenerator = draftGenerator;
	}

	public List<Product> listProducts(CustomerKind customerType) {
		return customerType == null ? catalog.all() : catalog.productsFor(customerType);
	}

	public Product getProduct(String id) {
		return catalog.find(id)
				.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Product not found"));
	}

	public ProductDraftResponseDto draftProduct(String description) {
		ProductDraft draft = draftGenerator.generate(description);
		return new ProductDraftResponseDto(draft.product(), draft.warnings(), draft.model());
	}
}
