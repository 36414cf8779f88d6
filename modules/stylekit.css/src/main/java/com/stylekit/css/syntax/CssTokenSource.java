package com.stylekit.css.syntax;

import stylekit.css.syntax.CssToken;

/**
 * Pull-based source of positioned tokens. Once the end of the input has been reached,
 * every further call returns an {@link stylekit.css.syntax.CssTokenType#EOF} token.
 */
@FunctionalInterface
public interface CssTokenSource {

    CssToken next();
}
