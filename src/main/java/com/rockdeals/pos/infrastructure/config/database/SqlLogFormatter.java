package com.rockdeals.pos.infrastructure.config.database;

import com.p6spy.engine.logging.Category;
import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy SQL 로그 포맷
 *
 * - DDL은 Hibernate DDL 포맷, 나머지는 BASIC 포맷으로 줄바꿈
 * - commit/rollback 같은 SQL 없는 이벤트는 한 줄로 출력
 * - 형식: [conn=3] 2ms statement | SQL
 */
public class SqlLogFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        String header = String.format("[conn=%d] %dms %s", connectionId, elapsed, category);
        if (sql == null || sql.isBlank()) {
            return header;
        }
        return header + " |" + format(category, sql.trim());
    }

    String format(String category, String sql) {
        if (!Category.STATEMENT.getName().equals(category)) {
            return " " + sql;
        }
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("comment")) {
            return FormatStyle.DDL.getFormatter().format(sql);
        }
        return FormatStyle.BASIC.getFormatter().format(sql);
    }
}
