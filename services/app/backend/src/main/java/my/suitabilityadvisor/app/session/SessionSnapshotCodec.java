package my.suitabilityadvisor.app.session;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

public class SessionSnapshotCodec {
	private final ObjectMapper mapper;

	public SessionSnapshotCodec() {
		this.mapper = JsonMapper.builder()
				.addModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public byte[] encode(SessionSnapshot snapshot) {
		try {
			return mapper.writeValueAsBytes(snapshot);
		} catch (IOException ex) {
			throw new SessionStoreException("Failed to serialize session snapshot", ex);
		}
	}

	public SessionSnapshot decode(byte[] data) {
		try {
			return mapper.readValue(data, SessionSnapshot.class);
		} catch (IOException ex) {
			throw new SessionStoreException("Failed to read session snapshot: " + ex.getMessage(), ex);
		}
	}
}
