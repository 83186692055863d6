package slim;

public enum DoctypeFormat {
    HTML,
    XHTML
}
