package my.suitabilityadvisor.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.Product;
import my.suitabilityadvisor.app.dto.ProductDraftRequest;
import my.suitabilityadvisor.app.dto.ProductDraftResponseDto;
import my.suitabilityadvisor.app.service.ProductService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/products")
@Tag(name = "Products")
public class ProductController {
	private final ProductService productService;

	public ProductController(ProductService productService) {
		this.productService = productService;
	}

	@GetMapping
	@Operation(summary = "List catalog products", description = "Optionally restricted to products offered to a customer type.")
	public List<Product> listProducts(@RequestParam(name = "customerType", required = false) CustomerKind customerType) {
		return productService.listProducts(customerType);
	}

	@GetMapping("/{productId}")
	@Operation(summary = "Get a catalog product")
	public Product getProduct(@PathVariable("productId") String productId) {
		return productService.getProduct(productId);
	}

	@PostMapping("/draft")
	@Operation(summary = "Draft a product definition from a text description")
	public ProductDraftResponseDto draftProduct(@Valid @RequestBody ProductDraftRequest request) {
		return productService.draftProduct(request.description());
	}
}
