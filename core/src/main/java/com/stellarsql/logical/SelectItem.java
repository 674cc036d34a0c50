package com.stellarsql.logical;

import com.stellarsql.parser.SourcePosition;

/**
 * An item of a select list: a value with an optional alias, or a
 * {@code *} / {@code t.*} wildcard.
 */
public sealed interface SelectItem permits DerivedColumn, AllColumns {

    SourcePosition position();
}
