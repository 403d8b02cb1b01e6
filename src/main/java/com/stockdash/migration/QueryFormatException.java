package com.stockdash.migration;

import java.sql.SQLException;

/**
 * Raised when a statement handed to {@link StatementAdapter} is neither SQL text nor a
 * well-formed {@link QueryFragment}.
 */
public class QueryFormatException extends SQLException {
    public QueryFormatException(String message) {
        super(message);
    }
}
