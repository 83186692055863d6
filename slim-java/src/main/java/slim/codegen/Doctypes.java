package slim.codegen;

import slim.CompileException;
import slim.DoctypeFormat;
import slim.ast.Doctype;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Doctypes {
    private Doctypes() {}

    public static final String HTML5 = "<!DOCTYPE html>";

    private static final Map<String, String> HTML = Map.of(
            "5", HTML5,
            "html", HTML5,
            "strict", "<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01//EN\" \"http://www.w3.org/TR/html4/strict.dtd\">",
            "frameset", "<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01 Frameset//EN\" \"http://www.w3.org/TR/html4/frameset.dtd\">",
            "transitional", "<!DOCTYPE html PUBLIC \"-//W3C//DTD HTML 4.01 Transitional//EN\" \"http://www.w3.org/TR/html4/loose.dtd\">"
    );

    private static final Map<String, String> XHTML = Map.of(
            "1.1", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.1//EN\" \"http://www.w3.org/TR/xhtml11/DTD/xhtml11.dtd\">",
            "5", HTML5,
            "html", HTML5,
            "strict", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Strict//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-strict.dtd\">",
            "frameset", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Frameset//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-frameset.dtd\">",
            "mobile", "<!DOCTYPE html PUBLIC \"-//WAPFORUM//DTD XHTML Mobile 1.2//EN\" \"http://www.openmobilealliance.org/tech/DTD/xhtml-mobile12.dtd\">",
            "basic", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML Basic 1.1//EN\" \"http://www.w3.org/TR/xhtml-basic/xhtml-basic11.dtd\">",
            "transitional", "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Transitional//EN\" \"http://www.w3.org/TR/xhtml1/DTD/xhtml1-transitional.dtd\">"
    );

    private static final Pattern XML = Pattern.compile("^xml(?:\\s+(.+?))?$");

    public static String render(Doctype doctype) {
        String shorthand = doctype.shorthand().trim();

        Matcher m = XML.matcher(shorthand);
        if (m.matches()) {
            if (doctype.format() == DoctypeFormat.HTML) {
                throw new CompileException("Invalid xml directive with html format", doctype.position());
            }
            String encoding = m.group(1) == null ? "utf-8" : m.group(1);
            return "<?xml version=\"1.0\" encoding=\"" + encoding + "\" ?>";
        }

        Map<String, String> table = doctype.format() == DoctypeFormat.XHTML ? XHTML : HTML;
        return table.getOrDefault(shorthand, HTML5);
    }
}
