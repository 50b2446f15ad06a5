package my.suitabilityadvisor.app.session;

import my.suitabilityadvisor.app.domain.CustomerKind;
import my.suitabilityadvisor.app.domain.ManualFields;
import my.suitabilityadvisor.app.domain.RunStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSessionStateStoreTest {
	@TempDir
	Path tempDir;

	@Test
	void writesAndReadsSnapshotFile() {
		Path file = tempDir.resolve("nested").resolve("session.json");
		FileSessionStateStore store = new FileSessionStateStore(new SessionSnapshotCodec(), file, 1024 * 1024);
		SessionSnapshot snapshot = new SessionSnapshot(2,
				new ManualFields(CustomerKind.SME, "Acme", null, "AE", null, null),
				null, null, null, 4L, RunStatus.FAILED, null, 30, "Document Validation Failed", null);

		store.save(snapshot);

		assertThat(file).exists();
		assertThat(file.resolveSibling("session.json.tmp")).doesNotExist();
		SessionSnapshot loaded = store.load().orElseThrow();
		assertThat(loaded.manualFields().customerType()).isEqualTo(CustomerKind.SME);
		assertThat(loaded.status()).isEqualTo(RunStatus.FAILED);
		assertThat(loaded.error()).isEqualTo("Document Validation Failed");
	}

	@Test
	void missingFileLoadsNothing() {
		FileSessionStateStore store = new FileSessionStateStore(new SessionSnapshotCodec(), tempDir.resolve("none.json"), 1024);

		assertThat(store.load()).isEmpty();
		store.clear();
	}

	@Test
	void corruptFileRaisesStoreException() throws Exception {
		Path file = tempDir.resolve("session.json");
		Files.writeString(file, "{broken", StandardCharsets.UTF_8);
		FileSessionStateStore store = new FileSessionStateStore(new SessionSnapshotCodec(), file, 1024);

		assertThatThrownBy(store::load).isInstanceOf(SessionStoreException.class);
	}

	@Test
	void clearDeletesFile() {
		Path file = tempDir.resolve("session.json");
		FileSessionStateStore store = new FileSessionStateStore(new SessionSnapshotCodec(), file, 1024);
		store.save(new SessionSnapshot(1, null, null, null, null, null, null, null, null, null, null));

		store.clear();

		assertThat(file).doesNotExist();
	}
}
