package my.suitabilityadvisor.app.session;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemorySessionStateStore implements SessionStateStore {
	private final SessionSnapshotCodec codec;
	private final int maxBytes;
	private final AtomicReference<byte[]> stored = new AtomicReference<>();

	public InMemorySessionStateStore(SessionSnapshotCodec codec, int maxBytes) {
		this.codec = codec;
		this.maxBytes = maxBytes;
	}

	@Override
	public void save(SessionSnapshot snapshot) {
		byte[] data = codec.encode(snapshot);
		if (data.length > maxBytes) {
			throw new SessionStoreException("Session snapshot exceeds storage quota (" + data.length + " > " + maxBytes + " bytes)");
		}
		stored.set(data);
	}

	@Override
	public Optional<SessionSnapshot> load() {
		byte[] data = stored.get();
		return data == null ? Optional.empty() : Optional.of(codec.decode(data));
	}

	@Override
	public void clear() {
		stored.set(null);
	}
}
