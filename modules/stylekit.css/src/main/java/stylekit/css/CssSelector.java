package stylekit.css;

import java.util.List;
import java.util.Objects;

/**
 * The selector list of a style or page rule, in normalized textual form.
 *
 * @param text the selector list with whitespace collapsed
 * @param selectors the comma-separated complex selectors of the list
 */
public record CssSelector(String text, List<String> selectors) implements CssFormattable {

    public CssSelector {
        Objects.requireNonNull(text, "text cannot be null");
        selectors = List.copyOf(selectors);
    }

    @Override
    public String toCss() {
        return text;
    }
}
