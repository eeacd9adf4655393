package works.bsonic.serde.bridge;

import works.bsonic.exceptions.BsonException;
import works.bsonic.exceptions.ErrorPath;

final class ErrorPaths {
	private ErrorPaths() { }

	static void field(boolean track, BsonException e, String key) {
		if (track) {
			e.prependPathSegment(new ErrorPath.Field(key));
		}
	}

	static void index(boolean track, BsonException e, int index) {
		if (track) {
			e.prependPathSegment(new ErrorPath.Index(index));
		}
	}
}
