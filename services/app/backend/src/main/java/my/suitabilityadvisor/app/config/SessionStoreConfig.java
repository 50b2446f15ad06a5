package my.suitabilityadvisor.app.config;

import my.suitabilityadvisor.app.session.FileSessionStateStore;
import my.suitabilityadvisor.app.session.InMemorySessionStateStore;
import my.suitabilityadvisor.app.session.SessionSnapshotCodec;
import my.suitabilityadvisor.app.session.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;

@Configuration
public class SessionStoreConfig {
	private static final Logger logger = LoggerFactory.getLogger(SessionStoreConfig.class);
	private static final String DEFAULT_FILE = "data/session.json";

	@Bean
	@ConditionalOnMissingBean(SessionStateStore.class)
	public SessionStateStore sessionStateStore(AppProperties properties) {
		AppProperties.Session session = properties.sessionOrDefault();
		String store = session.store() == null ? "memory" : session.store().trim().toLowerCase(Locale.ROOT);
		SessionSnapshotCodec codec = new SessionSnapshotCodec();
		switch (store) {
			case "memory":
				logger.info("Session snapshots kept in memory (max {} bytes).", session.maxSnapshotBytesOrDefault());
				return new InMemorySessionStateStore(codec, session.maxSnapshotBytesOrDefault());
			case "file":
				Path file = Path.of(session.filePath() == null || session.filePath().isBlank() ? DEFAULT_FILE : session.filePath());
				logger.info("Session snapshots stored in {}.", file.toAbsolutePath());
				return new FileSessionStateStore(codec, file, session.maxSnapshotBytesOrDefault());
			default:
				throw new IllegalStateException("Unsupported app.session.store: " + session.store());
		}
	}
}
