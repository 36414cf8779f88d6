package stylekit.css;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * The comma-separated media queries of an {@code @media} or {@code @import} rule.
 * An empty list matches all media.
 *
 * @see <a href="https://www.w3.org/TR/cssom-1/#the-medialist-interface">MediaList</a>
 */
public final class MediaList implements CssFormattable, Iterable<CssMedium> {

    private final CssParser parser;
    private final List<CssMedium> media = new ArrayList<>();

    public MediaList(CssParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
    }

    public int getLength() {
        return media.size();
    }

    public boolean isEmpty() {
        return media.isEmpty();
    }

    public CssMedium get(int index) {
        return media.get(index);
    }

    public List<CssMedium> getMedia() {
        return Collections.unmodifiableList(media);
    }

    public void add(CssMedium medium) {
        media.add(Objects.requireNonNull(medium, "medium cannot be null"));
    }

    public void clear() {
        media.clear();
    }

    public String getMediaText() {
        return toCss();
    }

    /**
     * Replaces the media queries with the ones parsed from the text.
     *
     * @throws CssSyntaxException if the text contains a malformed media query
     */
    public void setMediaText(String text) {
        List<CssMedium> parsed = parser.parseMediaList(text);
        media.clear();
        media.addAll(parsed);
    }

    /**
     * Parses a media query and appends it, unless an equal one is already present.
     *
     * @throws CssSyntaxException if the text is not a media query
     */
    public void appendMedium(String text) {
        CssMedium medium = parseMedium(text);

        if (!media.contains(medium)) {
            media.add(medium);
        }
    }

    /**
     * Removes the media query that equals the parsed one.
     *
     * @throws CssSyntaxException if the text is not a media query
     * @throws IllegalArgumentException if no such media query is present
     */
    public void deleteMedium(String text) {
        CssMedium medium = parseMedium(text);

        if (!media.remove(medium)) {
            throw new IllegalArgumentException("Medium not found: " + text);
        }
    }

    private CssMedium parseMedium(String text) {
        CssMedium medium = parser.parseMedium(text);

        if (medium == null) {
            throw new CssSyntaxException("Invalid medium: " + text);
        }

        return medium;
    }

    @Override
    public Iterator<CssMedium> iterator() {
        return getMedia().iterator();
    }

    @Override
    public String toCss() {
        return CssFormat.join(media, ", ");
    }

    @Override
    public String toString() {
        return toCss();
    }
}
