package works.bsonic.raw;

import works.bsonic.types.ObjectId;

public record RawDbPointerRef(String namespace, ObjectId id) {
}
