package stylekit.css;

import com.stylekit.css.parser.CssBuilder;
import com.stylekit.css.syntax.CssParserError;
import com.stylekit.css.syntax.CssTokenizer;
import com.stylekit.css.util.Logging;
import stylekit.css.condition.CssCondition;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Parses stylesheets and their parts.
 * <p>
 * Every parse method reads its input completely and never fails on malformed CSS: errors are
 * reported to the registered error listeners, logged, and the malformed parts are dropped.
 * Methods that parse a single construct return {@code null} if the input does not consist of
 * exactly one such construct.
 * <p>
 * A parser can be used by multiple threads; each parse uses its own builder.
 */
public final class CssParser {

    private final CssParserOptions options;
    private final List<Consumer<CssParserError>> errorListeners = new CopyOnWriteArrayList<>();

    public CssParser() {
        this(CssParserOptions.DEFAULT);
    }

    public CssParser(CssParserOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public CssParserOptions getOptions() {
        return options;
    }

    public void addErrorListener(Consumer<CssParserError> listener) {
        errorListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeErrorListener(Consumer<CssParserError> listener) {
        errorListeners.remove(listener);
    }

    /**
     * Parses a stylesheet.
     */
    public CssStyleSheet parseStyleSheet(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        var errors = new ArrayList<CssParserError>();
        var sheet = new CssStyleSheet(this);
        var builder = newBuilder(new CssTokenizer(text, handler(errors)), errors);
        builder.createRules(sheet);
        sheet.setSource(builder.getRoot());
        sheet.addErrors(errors);
        return sheet;
    }

    /**
     * Parses a stylesheet from a stream. The stream is not closed.
     *
     * @throws IOException if the stream cannot be read
     */
    public CssStyleSheet parseStyleSheet(InputStream input, Charset charset) throws IOException {
        Objects.requireNonNull(input, "input cannot be null");
        Objects.requireNonNull(charset, "charset cannot be null");
        Reader reader = new InputStreamReader(input, charset);
        var errors = new ArrayList<CssParserError>();
        var sheet = new CssStyleSheet(this);

        try {
            var builder = newBuilder(new CssTokenizer(reader, handler(errors)), errors);
            builder.createRules(sheet);
            sheet.setSource(builder.getRoot());
        } catch (UncheckedIOException ex) {
            throw ex.getCause();
        }

        sheet.addErrors(errors);
        return sheet;
    }

    /**
     * Parses a single rule.
     *
     * @return the rule, or {@code null}
     */
    public CssRule parseRule(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();

        if (builder.isAtEnd()) {
            return null;
        }

        CssRule rule = builder.createRule();
        builder.advance();
        return builder.isAtEnd() ? rule : null;
    }

    /**
     * Parses a single keyframe rule, such as {@code 50% { opacity: 0.5 }}.
     *
     * @return the rule, or {@code null}
     */
    public CssKeyframeRule parseKeyframeRule(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        CssKeyframeRule rule = builder.createKeyframeRule();
        builder.advance();
        return builder.isAtEnd() ? rule : null;
    }

    /**
     * Parses a single declaration, such as {@code color: red !important}.
     *
     * @return the property with its value, or {@code null}
     */
    public CssProperty parseDeclaration(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        CssProperty property = builder.createDeclaration();
        builder.collectTrivia();
        return property != null && property.hasValue() && builder.isAtEnd() ? property : null;
    }

    /**
     * Parses a list of declarations that is not enclosed in braces.
     */
    public CssStyleDeclaration parseDeclarations(String text) {
        var style = new CssStyleDeclaration(this);
        newBuilder(text).fillDeclarations(style);
        return style;
    }

    /**
     * Parses a value.
     *
     * @return the value, or {@code null} if the text is not a single valid value
     */
    public CssValue parseValue(String text) {
        CssBuilder builder = newBuilder(text);
        CssValue value = builder.createValue();
        return builder.isAtEnd() ? value : null;
    }

    /**
     * Parses the condition of a {@code @supports} rule.
     *
     * @return the condition, or {@code null} if the text is not a single condition
     */
    public CssCondition parseCondition(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        CssCondition condition = builder.createCondition();
        builder.collectTrivia();
        return builder.isAtEnd() ? condition : null;
    }

    /**
     * Parses a comma-separated list of media queries.
     *
     * @throws CssSyntaxException if a media query is malformed
     */
    public List<CssMedium> parseMediaList(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        return builder.createMedia();
    }

    /**
     * Parses a single media query.
     *
     * @return the medium, or {@code null}
     */
    public CssMedium parseMedium(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        CssMedium medium = builder.createMedium();
        builder.collectTrivia();
        return builder.isAtEnd() ? medium : null;
    }

    /**
     * Parses the key list of a keyframe rule, such as {@code from, 50%}.
     *
     * @return the selector, or {@code null}
     */
    public KeyframeSelector parseKeyframeSelector(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        KeyframeSelector selector = builder.createKeyframeSelector();
        return builder.isAtEnd() ? selector : null;
    }

    /**
     * Parses the functions of a {@code @document} rule.
     *
     * @return the functions, or {@code null} if the text is not a list of document functions
     */
    public List<DocumentFunction> parseDocumentFunctions(String text) {
        CssBuilder builder = newBuilder(text);
        builder.advance();
        List<DocumentFunction> functions = builder.createFunctions();
        builder.collectTrivia();
        return builder.isAtEnd() ? functions : null;
    }

    private CssBuilder newBuilder(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        var errors = new ArrayList<CssParserError>();
        return newBuilder(new CssTokenizer(text, handler(errors)), errors);
    }

    private CssBuilder newBuilder(CssTokenizer tokenizer, List<CssParserError> errors) {
        return new CssBuilder(tokenizer, this, handler(errors));
    }

    private Consumer<CssParserError> handler(List<CssParserError> errors) {
        return error -> {
            errors.add(error);
            reportError(error);
        };
    }

    private void reportError(CssParserError error) {
        Logger logger = Logging.getCSSLogger();
        if (logger.isLoggable(Level.WARNING)) {
            logger.log(Level.WARNING, "CSS error: " + error);
        }

        for (Consumer<CssParserError> listener : errorListeners) {
            listener.accept(error);
        }
    }
}
