package stylekit.css;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered block of declarations.
 * <p>
 * Setting a property that is already declared replaces the earlier declaration, so the last
 * declaration of a property wins. Property names are case-insensitive, except for custom
 * properties (names starting with {@code --}).
 *
 * @see <a href="https://www.w3.org/TR/cssom-1/#the-cssstyledeclaration-interface">CSSStyleDeclaration</a>
 */
public final class CssStyleDeclaration implements CssFormattable, Iterable<CssProperty> {

    private final CssParser parser;
    private final Map<String, CssProperty> properties = new LinkedHashMap<>();

    public CssStyleDeclaration(CssParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    private static String key(String name) {
        return name.startsWith("--") ? name : name.toLowerCase();
    }

    public int getLength() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public List<CssProperty> getProperties() {
        return Collections.unmodifiableList(new ArrayList<>(properties.values()));
    }

    public CssProperty getProperty(String name) {
        return properties.get(key(name));
    }

    /**
     * Returns the textual value of the property, or an empty string if it is not declared.
     */
    public String getPropertyValue(String name) {
        CssProperty property = getProperty(name);
        return property != null && property.hasValue() ? property.getValue().toCss() : "";
    }

    /**
     * Returns {@code "important"} if the property is declared as important, or an empty string.
     */
    public String getPropertyPriority(String name) {
        CssProperty property = getProperty(name);
        return property != null && property.isImportant() ? "important" : "";
    }

    public void setProperty(CssProperty property) {
        // A redeclared property keeps the position of its first declaration.
        properties.put(key(property.getName()), property);
    }

    /**
     * Parses and sets a single declaration.
     *
     * @throws CssSyntaxException if the declaration cannot be parsed
     */
    public void setProperty(String name, String value, String priority) {
        String text = name + ": " + value + ("important".equalsIgnoreCase(priority) ? " !important" : "");
        CssProperty property = parser.parseDeclaration(text);

        if (property == null) {
            throw new CssSyntaxException("Invalid declaration: " + text);
        }

        setProperty(property);
    }

    /**
     * Removes the property and returns its former value, or an empty string if it was not declared.
     */
    public String removeProperty(String name) {
        CssProperty property = properties.remove(key(name));
        return property != null && property.hasValue() ? property.getValue().toCss() : "";
    }

    public String getCssText() {
        return toCss();
    }

    /**
     * Replaces all declarations with the declarations parsed from the text.
     */
    public void setCssText(String text) {
        CssStyleDeclaration parsed = parser.parseDeclarations(text);
        properties.clear();
        properties.putAll(parsed.properties);
    }

    void replaceWith(CssStyleDeclaration other) {
        properties.clear();
        properties.putAll(other.properties);
    }

    @Override
    public Iterator<CssProperty> iterator() {
        return getProperties().iterator();
    }

    @Override
    public String toCss() {
        return CssFormat.join(getProperties(), "; ");
    }

    @Override
    public String toString() {
        return toCss();
    }
}
