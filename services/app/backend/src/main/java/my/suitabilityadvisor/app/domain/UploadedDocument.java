package my.suitabilityadvisor.app.domain;

import java.util.Arrays;
import java.util.Objects;

public record UploadedDocument(String name, String mimeType, byte[] content, String docType) {
	public UploadedDocument {
		content = content == null ? new byte[0] : content;
	}

	public boolean matches(String otherName, String otherDocType) {
		return Objects.equals(name, otherName) && Objects.equals(docType, otherDocType);
	}

	public int size() {
		return content.length;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof UploadedDocument that)) {
			return false;
		}
		return Objects.equals(name, that.name)
				&& Objects.equals(mimeType, that.mimeType)
				&& Arrays.equals(content, that.content)
				&& Objects.equals(docType, that.docType);
	}

	@Override
	public int hashCode() {
		int result = Objects.hash(name, mimeType, docType);
		return 31 * result + Arrays.hashCode(content);
	}

	@Override
	public String toString() {
		return "UploadedDocument{name=" + name + ", mimeType=" + mimeType + ", docType=" + docType
				+ ", bytes=" + content.length + "}";
	}
}
