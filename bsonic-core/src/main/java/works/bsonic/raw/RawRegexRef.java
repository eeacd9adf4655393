package works.bsonic.raw;

public record RawRegexRef(String pattern, String options) {
}
