package my.suitabilityadvisor.app.config;

import my.suitabilityadvisor.app.catalog.ProductCatalog;
import my.suitabilityadvisor.app.catalog.ProductCatalogLoader;
import my.suitabilityadvisor.app.rules.ScoringEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class CatalogConfig {
	@Bean
	public ProductCatalogLoader productCatalogLoader() {
		return new ProductCatalogLoader();
	}

	@Bean
	public ProductCatalog productCatalog(ProductCatalogLoader loader,
										 ResourceLoader resourceLoader,
										 @Value("${app.catalog.location:" + ProductCatalogLoader.DEFAULT_LOCATION + "}") String location) {
		return loader.load(resourceLoader, location);
	}

	@Bean
	public ScoringEngine scoringEngine() {
		return new ScoringEngine();
	}
}
