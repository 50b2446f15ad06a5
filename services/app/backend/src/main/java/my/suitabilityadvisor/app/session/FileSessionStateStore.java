package my.suitabilityadvisor.app.session;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

public class FileSessionStateStore implements SessionStateStore {
	private final SessionSnapshotCodec codec;
	private final Path file;
	private final int maxBytes;

	public FileSessionStateStore(SessionSnapshotCodec codec, Path file, int maxBytes) {
		this.codec = codec;
		this.file = file;
		this.maxBytes = maxBytes;
	}

	@Override
	public synchronized void save(SessionSnapshot snapshot) {
		byte[] data = codec.encode(snapshot);
		if (data.length > maxBytes) {
			throw new SessionStoreException("Session snapshot exceeds storage quota (" + data.length + " > " + maxBytes + " bytes)");
		}
		Path temp = file.resolveSibling(file.getFileName() + ".tmp");
		try {
			Path parent = file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.write(temp, data);
			try {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException ex) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException ex) {
			throw new SessionStoreException("Failed to write session snapshot to " + file, ex);
		}
	}

	@Override
	public synchronized Optional<SessionSnapshot> load() {
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(codec.decode(Files.readAllBytes(file)));
		} catch (IOException ex) {
			throw new SessionStoreException("Failed to read session snapshot from " + file, ex);
		}
	}

	@Override
	public synchronized void clear() {
		try {
			Files.deleteIfExists(file);
		} catch (IOException ex) {
			throw new SessionStoreException("Failed to delete session snapshot " + file, ex);
		}
	}
}
