package com.stylekit.css.parser;

import com.stylekit.css.syntax.CssNode;
import com.stylekit.css.syntax.CssNodeStack;
import com.stylekit.css.syntax.CssParserError;
import com.stylekit.css.syntax.CssTokenCursor;
import com.stylekit.css.syntax.CssTokenSource;
import stylekit.css.CssCharsetRule;
import stylekit.css.CssDocumentRule;
import stylekit.css.CssFontFaceRule;
import stylekit.css.CssGroupingRule;
import stylekit.css.CssImportRule;
import stylekit.css.CssKeyframeRule;
import stylekit.css.CssKeyframesRule;
import stylekit.css.CssMediaRule;
import stylekit.css.CssMedium;
import stylekit.css.CssNamespaceRule;
import stylekit.css.CssPageRule;
import stylekit.css.CssParser;
import stylekit.css.CssParserOptions;
import stylekit.css.CssProperty;
import stylekit.css.CssRule;
import stylekit.css.CssSelector;
import stylekit.css.CssStyleDeclaration;
import stylekit.css.CssStyleRule;
import stylekit.css.CssStyleSheet;
import stylekit.css.CssSupportsRule;
import stylekit.css.CssSyntaxException;
import stylekit.css.CssUnknownProperty;
import stylekit.css.CssUnknownRule;
import stylekit.css.CssValue;
import stylekit.css.CssViewportRule;
import stylekit.css.DocumentFunction;
import stylekit.css.KeyframeSelector;
import stylekit.css.MediaFeature;
import stylekit.css.MediaList;
import stylekit.css.UnknownMediaFeature;
import stylekit.css.condition.AndCondition;
import stylekit.css.condition.CssCondition;
import stylekit.css.condition.DeclarationCondition;
import stylekit.css.condition.EmptyCondition;
import stylekit.css.condition.GroupCondition;
import stylekit.css.condition.NotCondition;
import stylekit.css.condition.OrCondition;
import stylekit.css.syntax.CssToken;
import stylekit.css.syntax.CssTokenType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import static stylekit.css.syntax.CssTokenType.*;

/**
 * Builds rules, declarations, conditions and media lists from a stream of tokens.
 * <p>
 * The builder reads tokens through a {@link CssTokenCursor}. Every production starts at the
 * current token of the cursor and leaves the cursor at the last token that belongs to the
 * construct it built (for example, the closing {@code }} of a rule), unless stated otherwise.
 * Malformed input never aborts the build: the smallest malformed construct is reported,
 * skipped and dropped, and building resumes after it.
 * <p>
 * If the parser options ask for trivia to be stored, every construct is recorded as a
 * {@link CssNode} of a concrete syntax tree that reproduces the source text exactly.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#parsing">CSS Syntax Module Level 3, Parsing</a>
 */
public final class CssBuilder {

    private static final String NOT = "not";
    private static final String ONLY = "only";
    private static final String AND = "and";
    private static final String OR = "or";
    private static final String FROM = "from";
    private static final String TO = "to";

    // A value that was rejected as invalid has already been reported.
    private record ParsedValue(CssValue value, boolean important, boolean rejected) {}

    private final CssParser parser;
    private final CssParserOptions options;
    private final Consumer<CssParserError> errorHandler;
    private final CssPropertyFactory properties;
    private final MediaFeatureFactory mediaFeatures;
    private final CssNodeStack nodes;
    private final CssTokenCursor cursor;

    public CssBuilder(CssTokenSource source, CssParser parser, Consumer<CssParserError> errorHandler) {
        this(source, parser, errorHandler, CssPropertyFactory.getDefault(), MediaFeatureFactory.getDefault());
    }

    public CssBuilder(CssTokenSource source, CssParser parser, Consumer<CssParserError> errorHandler,
                      CssPropertyFactory properties, MediaFeatureFactory mediaFeatures) {
        this.parser = Objects.requireNonNull(parser, "parser cannot be null");
        this.options = parser.getOptions();
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler cannot be null");
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
        this.mediaFeatures = Objects.requireNonNull(mediaFeatures, "mediaFeatures cannot be null");
        this.nodes = new CssNodeStack(options.storeTrivia());
        this.cursor = new CssTokenCursor(source, nodes);
    }

    /**
     * Returns the root of the concrete syntax tree, or {@code null} if trivia are not stored.
     */
    public CssNode getRoot() {
        return nodes.getRoot();
    }

    public CssToken current() {
        return cursor.current();
    }

    /**
     * Reads the next token and skips trivia.
     */
    public CssToken advance() {
        cursor.next();
        return cursor.collectTrivia();
    }

    public CssToken collectTrivia() {
        return cursor.collectTrivia();
    }

    public boolean isAtEnd() {
        return cursor.current() != null && cursor.isEof();
    }

    private void error(CssParserError.Kind kind, CssToken token) {
        errorHandler.accept(CssParserError.of(kind, token));
    }

    // ---------------------------------------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------------------------------------

    /**
     * Builds all rules of a stylesheet until the end of the input.
     */
    public void createRules(CssStyleSheet sheet) {
        advance();

        while (!cursor.isEof()) {
            CssRule rule;

            try (var scope = nodes.open()) {
                rule = createRule();
                advance();
                scope.complete(rule);
            }

            if (rule != null) {
                sheet.addRule(rule);
            }
        }
    }

    /**
     * Builds a rule that starts at the current token.
     * <p>
     * An at-keyword starts an at-rule, a token that cannot start a rule is reported and skipped,
     * and every other token starts a style rule.
     *
     * @return the rule, or {@code null} if no rule could be built
     */
    public CssRule createRule() {
        CssToken token = cursor.current();

        switch (token.type()) {
            case AT_KEYWORD:
                return createAtRule();

            case CURLY_BRACKET_OPEN:
                error(CssParserError.Kind.INVALID_BLOCK_START, token);
                skipRule();
                return null;

            case STRING:
            case URL:
            case CURLY_BRACKET_CLOSE:
            case ROUND_BRACKET_CLOSE:
            case SQUARE_BRACKET_CLOSE:
                error(CssParserError.Kind.INVALID_TOKEN, token);
                skipRule();
                return null;

            default:
                return createStyle();
        }
    }

    /**
     * Builds the at-rule that starts with the current at-keyword token.
     */
    public CssRule createAtRule() {
        String name = cursor.current().data().toLowerCase();

        return switch (name) {
            case "media" -> createMediaRule();
            case "font-face" -> createFontFace();
            case "keyframes" -> createKeyframes();
            case "import" -> createImport();
            case "charset" -> createCharset();
            case "namespace" -> createNamespace();
            case "page" -> createPage();
            case "supports" -> createSupports();
            case "viewport" -> createViewport();
            case "document" -> createDocument();
            default -> createUnknown();
        };
    }

    /*
     *     ╟──┤ @charset ├──┤ <string-token> ├──┤ ; ├──╢
     */
    private CssRule createCharset() {
        var rule = new CssCharsetRule(parser);
        CssToken token = advance();

        if (token.is(STRING)) {
            rule.setCharset(token.data());
        }

        jumpToEnd();
        return rule;
    }

    /*
     *                          ╭──────────────── , ────────────────╮
     *     ╟──┤ @document ├──┴──┤ <document-function> ├──┴──┤ {} block of rules ├──╢
     */
    private CssRule createDocument() {
        var rule = new CssDocumentRule(parser);
        advance();
        fillFunctions(rule);
        collectTrivia();

        if (!cursor.is(CURLY_BRACKET_OPEN) || rule.getFunctions().isEmpty()) {
            return skipDeclarations();
        }

        fillRules(rule);
        return rule;
    }

    private CssRule createViewport() {
        var rule = new CssViewportRule(parser);
        advance();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            return skipDeclarations();
        }

        fillDeclarations(rule.getStyle(), properties::createViewport);
        return rule;
    }

    private CssRule createFontFace() {
        var rule = new CssFontFaceRule(parser);
        advance();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            return skipDeclarations();
        }

        fillDeclarations(rule.getStyle(), properties::createFont);
        return rule;
    }

    /*
     *     ╟──┤ @import ├──┤ <url> ├──┤ <media-query-list> ├──┤ ; ├──╢
     */
    private CssRule createImport() {
        var rule = new CssImportRule(parser);
        advance();
        String href = readUrl();

        if (href != null) {
            rule.setHref(href);
            fillMediaList(rule.getMedia(), SEMICOLON);
        }

        collectTrivia();
        jumpToEnd();
        return rule;
    }

    private CssRule createKeyframes() {
        var rule = new CssKeyframesRule(parser);
        CssToken token = advance();

        if (token.is(IDENT, STRING)) {
            rule.setName(token.data());
            advance();
        }

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            return skipDeclarations();
        }

        fillKeyframeRules(rule);
        return rule;
    }

    /*
     * If the media list is not followed by a block, a ';' makes the at-rule a malformed statement
     * that is dropped. Otherwise the block is filled from the next '{', or from the end of the input.
     */
    private CssRule createMediaRule() {
        var rule = new CssMediaRule(parser);
        advance();
        fillMediaList(rule.getMedia(), CURLY_BRACKET_OPEN);
        collectTrivia();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            while (!cursor.isEof()) {
                if (cursor.is(SEMICOLON)) {
                    return null;
                } else if (cursor.is(CURLY_BRACKET_OPEN)) {
                    break;
                }

                cursor.next();
            }
        }

        fillRules(rule);
        return rule;
    }

    /*
     *     ╟──┤ @namespace ├──┬──────────────────┬──┤ <url> ├──┤ ; ├──╢
     *                        ╰──┤ <ident-token> ├──╯
     */
    private CssRule createNamespace() {
        var rule = new CssNamespaceRule(parser);
        CssToken token = advance();

        if (token.is(IDENT)) {
            rule.setPrefix(token.data());
            advance();
        }

        String uri = readUrl();
        if (uri != null) {
            rule.setNamespaceUri(uri);
        }

        jumpToEnd();
        return rule;
    }

    private CssRule createPage() {
        var rule = new CssPageRule(parser);
        advance();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            rule.setSelector(createSelector());
            collectTrivia();
        }

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            return skipDeclarations();
        }

        fillDeclarations(rule.getStyle(), properties::create);
        return rule;
    }

    /*
     *     ╟──┤ @supports ├──┤ <supports-condition> ├──┤ {} block of rules ├──╢
     */
    private CssRule createSupports() {
        var rule = new CssSupportsRule(parser);
        advance();
        CssCondition condition = aggregateCondition();
        collectTrivia();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            return skipDeclarations();
        }

        rule.setCondition(condition != null ? condition : EmptyCondition.INSTANCE);
        fillRules(rule);
        return rule;
    }

    /*
     *     ╟──┤ <selector-list> ├──┤ {} block of declarations ├──╢
     */
    private CssRule createStyle() {
        var rule = new CssStyleRule(parser);
        collectTrivia();
        CssSelector selector = createSelector();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            error(cursor.isEof() ? CssParserError.Kind.UNEXPECTED_END_OF_FILE : CssParserError.Kind.INVALID_TOKEN,
                  cursor.current());
            return null;
        }

        fillDeclarations(rule.getStyle(), properties::create);

        if (selector == null) {
            return null;
        }

        rule.setSelector(selector);
        return rule;
    }

    /**
     * Builds a keyframe rule of a {@code @keyframes} block that starts at the current token.
     *
     * @return the rule, or {@code null} if the key list is malformed
     */
    public CssKeyframeRule createKeyframeRule() {
        var rule = new CssKeyframeRule(parser);
        collectTrivia();
        KeyframeSelector key = createKeyframeSelector();
        collectTrivia();

        if (!cursor.is(CURLY_BRACKET_OPEN)) {
            error(cursor.isEof() ? CssParserError.Kind.UNEXPECTED_END_OF_FILE : CssParserError.Kind.INVALID_TOKEN,
                  cursor.current());
            return null;
        }

        fillDeclarations(rule.getStyle(), properties::create);

        if (key == null) {
            return null;
        }

        rule.setKey(key);
        return rule;
    }

    /*
     * An unknown at-rule is either kept with its prelude and block as they were written, or
     * reported and skipped.
     */
    private CssRule createUnknown() {
        CssToken keyword = cursor.current();

        if (!options.includeUnknownRules()) {
            error(CssParserError.Kind.UNKNOWN_AT_RULE, keyword);
            skipRule();
            return null;
        }

        var prelude = new StringBuilder();
        var content = new StringBuilder();
        CssToken token = cursor.next();

        while (token.isNot(CURLY_BRACKET_OPEN, SEMICOLON, EOF)) {
            prelude.append(token.text());
            token = cursor.next();
        }

        if (!token.is(EOF)) {
            content.append(token.text());

            if (token.is(CURLY_BRACKET_OPEN)) {
                int depth = 1;

                do {
                    token = cursor.next();
                    content.append(token.text());

                    switch (token.type()) {
                        case CURLY_BRACKET_OPEN -> depth++;
                        case CURLY_BRACKET_CLOSE -> depth--;
                        case EOF -> depth = 0;
                        default -> {}
                    }
                } while (depth != 0);
            }
        }

        return new CssUnknownRule(parser, keyword.data(), prelude.toString(), content.toString());
    }

    // ---------------------------------------------------------------------------------------------
    // Blocks
    // ---------------------------------------------------------------------------------------------

    /*
     * Precondition: the current token is the '{' of the block.
     */
    private void fillRules(CssGroupingRule group) {
        advance();

        while (cursor.current().isNot(EOF, CURLY_BRACKET_CLOSE)) {
            CssRule rule;

            try (var scope = nodes.open()) {
                rule = createRule();
                advance();
                scope.complete(rule);
            }

            if (rule != null) {
                group.addRule(rule);
            }
        }
    }

    private void fillKeyframeRules(CssKeyframesRule parent) {
        advance();

        while (cursor.current().isNot(EOF, CURLY_BRACKET_CLOSE)) {
            CssKeyframeRule rule;

            try (var scope = nodes.open()) {
                rule = createKeyframeRule();
                advance();
                scope.complete(rule);
            }

            if (rule != null) {
                parent.addRule(rule);
            }
        }
    }

    /**
     * Fills the style with the declarations of a block. The current token is the {@code {} of the
     * block, or the token before the first declaration if the declarations are not enclosed in a block.
     * Only declarations that resolved to a property and obtained a value are applied.
     */
    public void fillDeclarations(CssStyleDeclaration style) {
        fillDeclarations(style, properties::create);
    }

    private void fillDeclarations(CssStyleDeclaration style, Function<String, CssProperty> createProperty) {
        advance();

        while (cursor.current().isNot(EOF, CURLY_BRACKET_CLOSE)) {
            CssProperty property = createDeclarationWith(createProperty);

            if (property != null && property.hasValue()) {
                style.setProperty(property);
            }

            collectTrivia();
        }
    }

    /**
     * Builds a declaration that starts at the current token.
     */
    public CssProperty createDeclaration() {
        collectTrivia();
        return createDeclarationWith(properties::create);
    }

    /**
     * Builds a declaration.
     *
     * <pre>{@code
     *        ┌──────────┐  ╭───╮  ┌─────────┐                      ╭───╮
     *     ╟──┤   name   ├──┤ : ├──┤  value  ├──┬──────────────┬─────┤ ; ├──╢
     *        └──────────┘  ╰───╯  └─────────┘  ╰─┤ !important ├─╯   ╰───╯
     * }</pre>
     *
     * The name is assembled from all tokens up to the next colon, trivia, brace or semicolon.
     * A name that cannot be resolved yields an unknown property. If the colon or the value is
     * missing, the rest of the declaration is skipped, so that the following declarations of
     * the block can still be read. A terminating {@code ;} is consumed.
     *
     * @return the property, or {@code null} if there is no name
     */
    private CssProperty createDeclarationWith(Function<String, CssProperty> createProperty) {
        try (var scope = nodes.open()) {
            CssProperty property = null;
            CssToken start = cursor.current();
            var name = new StringBuilder();

            while (cursor.current().isNot(EOF, COLON, SEMICOLON)
                    && cursor.current().isNot(CURLY_BRACKET_OPEN, CURLY_BRACKET_CLOSE)
                    && !cursor.current().type().isTrivia()) {
                name.append(cursor.current().toValue());
                cursor.next();
            }

            if (name.length() > 0) {
                String propertyName = name.toString();

                if (options.includeUnknownDeclarations() || options.tolerateInvalidValues()) {
                    property = new CssUnknownProperty(propertyName);
                } else {
                    property = createProperty.apply(propertyName);

                    if (property == null) {
                        error(CssParserError.Kind.UNKNOWN_DECLARATION_NAME, start);
                        property = new CssUnknownProperty(propertyName);
                    }
                }

                collectTrivia();

                if (cursor.is(COLON)) {
                    ParsedValue result = createValue(CURLY_BRACKET_CLOSE);

                    if (result.value() == null) {
                        if (!result.rejected()) {
                            error(CssParserError.Kind.VALUE_MISSING, cursor.current());
                        }
                    } else if (property.trySetValue(result.value())) {
                        property.setImportant(result.important());
                    }

                    collectTrivia();
                } else {
                    error(CssParserError.Kind.COLON_MISSING, cursor.current());
                }

                jumpToDeclEnd();
            } else if (!cursor.isEof()) {
                error(CssParserError.Kind.IDENT_EXPECTED, cursor.current());
                jumpToDeclEnd();
            }

            if (cursor.is(SEMICOLON)) {
                cursor.next();
            }

            return scope.complete(property);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Conditions
    // ---------------------------------------------------------------------------------------------

    /**
     * Builds a condition that starts at the current token.
     *
     * @return the condition, or {@code null} if no condition could be built
     */
    public CssCondition createCondition() {
        collectTrivia();
        return aggregateCondition();
    }

    /**
     * Builds conditions joined with a connector.
     *
     * <pre>{@code
     *                            ╭────────────────────────────╮
     *        ┌─────────────┐     │  ╭─────────╮  ┌───────────┐  │
     *     ╟──┤  condition  ├──┬──┴──┤ and|or  ├──┤ condition ├──┴──┬──╢
     *        └─────────────┘  │     ╰─────────╯  └───────────┘     │
     *                         ╰────────────────────────────────────╯
     * }</pre>
     *
     * The first connector fixes the connector of this level. All conditions joined by it are
     * collected into a single {@link AndCondition} or {@link OrCondition}. The other connector
     * ends the aggregate and is left as the current token.
     */
    private CssCondition aggregateCondition() {
        try (var scope = nodes.open()) {
            CssCondition condition = extractCondition();

            if (condition == null) {
                return scope.complete(null);
            }

            collectTrivia();
            CssToken token = cursor.current();

            if (token.isIdent(AND) || token.isIdent(OR)) {
                String connector = token.data().toLowerCase();
                advance();
                List<CssCondition> conditions = multipleConditions(condition, connector);

                if (conditions.size() < 2) {
                    return scope.complete(null);
                }

                condition = connector.equals(AND) ? new AndCondition(conditions) : new OrCondition(conditions);
            }

            return scope.complete(condition);
        }
    }

    /*
     * condition := ( <aggregate> ) | ( <declaration> ) | not <condition>
     */
    private CssCondition extractCondition() {
        try (var scope = nodes.open()) {
            CssCondition condition = null;

            if (cursor.is(ROUND_BRACKET_OPEN)) {
                advance();
                condition = aggregateCondition();

                if (condition != null) {
                    condition = new GroupCondition(condition);
                } else if (cursor.is(IDENT)) {
                    condition = declarationCondition();
                }

                if (cursor.is(ROUND_BRACKET_CLOSE)) {
                    advance();
                }
            } else if (cursor.current().isIdent(NOT)) {
                advance();
                condition = extractCondition();

                if (condition != null) {
                    condition = new NotCondition(condition);
                }
            }

            return scope.complete(condition);
        }
    }

    private CssCondition declarationCondition() {
        String name = cursor.current().data();
        CssProperty property = properties.create(name);

        if (property == null) {
            property = new CssUnknownProperty(name);
        }

        try (var scope = nodes.open()) {
            DeclarationCondition declaration = null;
            advance();

            if (cursor.is(COLON)) {
                ParsedValue result = createValue(ROUND_BRACKET_CLOSE);
                property.setImportant(result.important());

                if (result.value() != null) {
                    declaration = new DeclarationCondition(property, result.value());
                }
            }

            return scope.complete(declaration);
        }
    }

    private List<CssCondition> multipleConditions(CssCondition first, String connector) {
        var conditions = new ArrayList<CssCondition>();
        conditions.add(first);
        collectTrivia();

        while (!cursor.isEof()) {
            CssCondition condition = extractCondition();

            if (condition == null) {
                break;
            }

            conditions.add(condition);

            if (!cursor.current().isIdent(connector)) {
                break;
            }

            advance();
        }

        return conditions;
    }

    // ---------------------------------------------------------------------------------------------
    // Media
    // ---------------------------------------------------------------------------------------------

    /**
     * Builds the media queries of a standalone media list.
     *
     * @throws CssSyntaxException if a media query is malformed
     */
    public List<CssMedium> createMedia() {
        var media = new ArrayList<CssMedium>();
        collectTrivia();

        while (!cursor.isEof()) {
            try (var scope = nodes.open()) {
                CssMedium medium = createMedium();

                if (medium == null || cursor.current().isNot(COMMA, EOF)) {
                    throw new CssSyntaxException("Invalid media query at " + cursor.current());
                }

                advance();
                media.add(scope.complete(medium));
            }
        }

        return media;
    }

    /*
     * If the list does not end at the terminator, or one of its media is malformed, the whole
     * list is replaced with 'not all'. A list that starts at the terminator is empty.
     */
    private void fillMediaList(MediaList list, CssTokenType terminator) {
        if (cursor.is(terminator)) {
            return;
        }

        boolean failed = false;

        while (!cursor.isEof()) {
            CssMedium medium;

            try (var scope = nodes.open()) {
                medium = scope.complete(createMedium());
            }

            if (medium != null) {
                list.add(medium);
            } else {
                failed = true;
            }

            if (!cursor.is(COMMA)) {
                break;
            }

            advance();
        }

        if (!failed && cursor.is(terminator) && list.getLength() > 0) {
            return;
        }

        list.clear();
        list.add(CssMedium.NOT_ALL);
    }

    /**
     * Builds a media query.
     *
     * <pre>{@code
     *        ╭───────────────────╮                    ╭────────────────────────────────╮
     *        │    ╭─────────╮    │  ┌─────────────┐   │   ╭─────╮  ┌──────────────┐    │
     *     ╟──┴──┬─┤ not|only├─┬──┴──┤ media type  ├─┬─┴───┤ and ├──┤ media feature├──┬─┴──╢
     *           │ ╰─────────╯ │     └─────────────┘ │     ╰─────╯  └──────────────┘  │
     *           ╰─────────────╯                     ╰────────────────────────────────╯
     * }</pre>
     *
     * A medium without a type starts with a media feature.
     *
     * @return the medium, or {@code null} if it is malformed
     */
    public CssMedium createMedium() {
        boolean inverse = false;
        boolean exclusive = false;
        String type = "";
        var features = new ArrayList<MediaFeature>();
        CssToken token = collectTrivia();

        if (token.isIdent(NOT)) {
            inverse = true;
            token = advance();
        } else if (token.isIdent(ONLY)) {
            exclusive = true;
            token = advance();
        }

        if (token.is(IDENT)) {
            type = token.data();
            token = advance();

            if (!token.isIdent(AND)) {
                return new CssMedium(type, inverse, exclusive, features);
            }

            advance();
        }

        do {
            if (!cursor.is(ROUND_BRACKET_OPEN)) {
                return null;
            }

            advance();
            MediaFeature feature;

            try (var scope = nodes.open()) {
                feature = scope.complete(createFeature());
            }

            if (!cursor.is(ROUND_BRACKET_CLOSE) || feature == null) {
                return null;
            }

            features.add(feature);

            if (!advance().isIdent(AND)) {
                break;
            }

            advance();
        } while (!cursor.isEof());

        return new CssMedium(type, inverse, exclusive, features);
    }

    /*
     * Precondition: the current token is the first token after '('.
     * Postcondition: the current token is the closing ')', or the end of the input.
     */
    private MediaFeature createFeature() {
        if (!cursor.is(IDENT)) {
            jumpToArgEnd();
            return null;
        }

        String name = cursor.current().data();
        MediaFeature feature = options.tolerateInvalidConstraints()
            ? new UnknownMediaFeature(name)
            : mediaFeatures.create(name);
        CssValue value = CssValue.EMPTY;
        advance();

        if (cursor.is(COLON)) {
            var builder = new CssValueBuilder();
            cursor.next();

            while (!cursor.is(ROUND_BRACKET_CLOSE) || !builder.isReady()) {
                if (cursor.isEof()) {
                    break;
                }

                builder.apply(cursor.current());
                cursor.next();
            }

            CssValue result = builder.toValue();

            if (result != null) {
                if (!builder.isValid() && !options.tolerateInvalidValues()) {
                    error(CssParserError.Kind.INVALID_VALUE, cursor.current());
                    return null;
                }

                value = result;
            }
        } else if (cursor.isEof()) {
            return null;
        }

        if (feature != null && feature.trySetValue(value)) {
            return feature;
        }

        jumpToArgEnd();
        return null;
    }

    // ---------------------------------------------------------------------------------------------
    // Keyframes and document functions
    // ---------------------------------------------------------------------------------------------

    /**
     * Builds the key list of a keyframe rule, which ends before a brace or the end of the input.
     * {@code from} and {@code to} are read as 0% and 100%.
     *
     * @return the selector, or {@code null} if the key list is malformed
     */
    public KeyframeSelector createKeyframeSelector() {
        try (var scope = nodes.open()) {
            var keys = new ArrayList<Double>();
            CssToken start = cursor.current();
            boolean valid = true;
            boolean expectKey = true;
            collectTrivia();

            while (cursor.current().isNot(EOF, CURLY_BRACKET_OPEN, CURLY_BRACKET_CLOSE)) {
                if (expectKey) {
                    Double key = toKey(cursor.current());

                    if (key != null) {
                        keys.add(key);
                    } else {
                        valid = false;
                    }

                    expectKey = false;
                } else if (cursor.is(COMMA)) {
                    expectKey = true;
                } else {
                    valid = false;
                }

                advance();
            }

            if (!valid || expectKey) {
                error(CssParserError.Kind.INVALID_SELECTOR, start);
                return scope.complete(null);
            }

            return scope.complete(new KeyframeSelector(keys));
        }
    }

    private static Double toKey(CssToken token) {
        if (token.isIdent(FROM)) {
            return 0.0;
        }

        if (token.isIdent(TO)) {
            return 100.0;
        }

        if (token.is(PERCENTAGE)) {
            try {
                double value = Double.parseDouble(token.data());
                return value >= 0 && value <= 100 ? value : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }

        return null;
    }

    /**
     * Builds the comma-separated document functions that start at the current token.
     */
    public List<DocumentFunction> createFunctions() {
        var rule = new CssDocumentRule(parser);
        collectTrivia();
        fillFunctions(rule);
        return new ArrayList<>(rule.getFunctions());
    }

    private void fillFunctions(CssDocumentRule rule) {
        while (!cursor.isEof()) {
            DocumentFunction function;

            try (var scope = nodes.open()) {
                function = toDocumentFunction();

                if (function == null) {
                    break;
                }

                advance();
                scope.complete(function);
            }

            rule.addFunction(function);

            if (!cursor.is(COMMA)) {
                break;
            }

            advance();
        }
    }

    /*
     * Postcondition: the current token is the last token of the function.
     */
    private DocumentFunction toDocumentFunction() {
        CssToken token = cursor.current();

        if (token.is(URL)) {
            return new DocumentFunction(DocumentFunction.Kind.URL, token.data());
        }

        if (!token.is(FUNCTION)) {
            return null;
        }

        DocumentFunction.Kind kind = DocumentFunction.Kind.fromFunctionName(token.data());

        if (kind == null) {
            cursor.next();
            jumpToArgEnd();
            return null;
        }

        String argument = null;
        advance();

        if (cursor.is(STRING)) {
            argument = cursor.current().data();
            advance();
        } else if (kind == DocumentFunction.Kind.URL_PREFIX && cursor.is(ROUND_BRACKET_CLOSE)) {
            argument = "";
        }

        if (argument == null || !cursor.is(ROUND_BRACKET_CLOSE)) {
            jumpToArgEnd();
            return null;
        }

        return new DocumentFunction(kind, argument);
    }

    /*
     * url := <url-token> | <string-token> | url( <string-token> )
     *
     * Returns the URL and advances past it, or returns null. A malformed url() function is
     * skipped up to its closing parenthesis.
     */
    private String readUrl() {
        CssToken token = cursor.current();

        if (token.is(STRING, URL)) {
            advance();
            return token.data();
        }

        if (!token.is(FUNCTION) || !token.data().equalsIgnoreCase("url")) {
            return null;
        }

        String url = null;

        if (advance().is(STRING)) {
            url = cursor.current().data();
            advance();
        }

        if (!cursor.is(ROUND_BRACKET_CLOSE)) {
            url = null;
            jumpToArgEnd();
        }

        if (cursor.is(ROUND_BRACKET_CLOSE)) {
            advance();
        }

        return url;
    }

    // ---------------------------------------------------------------------------------------------
    // Values and selectors
    // ---------------------------------------------------------------------------------------------

    /**
     * Builds a value from the tokens after the current token, up to a {@code ;} or {@code }} that
     * is not nested in brackets. A trailing {@code !important} is not part of the value.
     *
     * @return the value, or {@code null} if the value is empty or invalid
     */
    public CssValue createValue() {
        return createValue(CURLY_BRACKET_CLOSE).value();
    }

    private ParsedValue createValue(CssTokenType closing) {
        var builder = new CssValueBuilder();
        CssToken start = cursor.next();

        try (var scope = nodes.open()) {
            while (!cursor.isEof()) {
                if (cursor.is(SEMICOLON) && builder.isReady() || cursor.is(closing) && builder.isReady(closing)) {
                    break;
                }

                builder.apply(cursor.current());
                cursor.next();
            }

            CssValue result = builder.toValue();
            boolean rejected = false;

            if (result != null && !builder.isValid() && !options.tolerateInvalidValues()) {
                error(CssParserError.Kind.INVALID_VALUE, start);
                result = null;
                rejected = true;
            }

            return new ParsedValue(scope.complete(result), builder.isImportant(), rejected);
        }
    }

    /*
     * Postcondition: the current token is '{', '}' or the end of the input.
     */
    private CssSelector createSelector() {
        var constructor = new CssSelectorConstructor();
        CssToken start = cursor.current();

        try (var scope = nodes.open()) {
            while (cursor.current().isNot(EOF, CURLY_BRACKET_OPEN, CURLY_BRACKET_CLOSE)) {
                constructor.apply(cursor.current());
                cursor.next();
            }

            CssSelector selector = constructor.toSelector();

            if (!constructor.isValid() && !options.tolerateInvalidValues()) {
                error(CssParserError.Kind.INVALID_SELECTOR, start);
                selector = null;
            }

            return scope.complete(selector);
        }
    }

    // ---------------------------------------------------------------------------------------------
    // Recovery
    // ---------------------------------------------------------------------------------------------

    private CssRule skipDeclarations() {
        error(CssParserError.Kind.INVALID_TOKEN, cursor.current());
        skipRule();
        return null;
    }

    /**
     * Skips to the {@code ;} or {@code }} that ends the current rule, counting nested blocks.
     * The current token is left at that token, or at the end of the input.
     */
    private void skipRule() {
        int depth = 0;

        while (!cursor.isEof()) {
            if (cursor.is(CURLY_BRACKET_OPEN)) {
                depth++;
            } else if (cursor.is(CURLY_BRACKET_CLOSE)) {
                depth--;
            }

            if (depth <= 0 && cursor.current().is(SEMICOLON, CURLY_BRACKET_CLOSE)) {
                break;
            }

            cursor.next();
        }
    }

    /**
     * Skips to the next {@code ;}, ignoring blocks.
     */
    private void jumpToEnd() {
        while (cursor.current().isNot(EOF, SEMICOLON)) {
            cursor.next();
        }
    }

    /**
     * Skips to the {@code )} that closes the current argument list, counting nested parentheses.
     */
    private void jumpToArgEnd() {
        int depth = 0;

        while (!cursor.isEof()) {
            if (cursor.current().is(ROUND_BRACKET_OPEN, FUNCTION)) {
                depth++;
            } else if (cursor.is(ROUND_BRACKET_CLOSE)) {
                if (depth <= 0) {
                    break;
                }

                depth--;
            }

            cursor.next();
        }
    }

    /**
     * Skips to the {@code ;} or {@code }} that ends the current declaration, counting nested blocks.
     */
    private void jumpToDeclEnd() {
        int depth = 0;

        while (!cursor.isEof()) {
            if (cursor.is(CURLY_BRACKET_OPEN)) {
                depth++;
            } else if (depth <= 0 && cursor.current().is(CURLY_BRACKET_CLOSE, SEMICOLON)) {
                break;
            } else if (cursor.is(CURLY_BRACKET_CLOSE)) {
                depth--;
            }

            cursor.next();
        }
    }
}
