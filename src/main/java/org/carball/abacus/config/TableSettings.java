package org.carball.abacus.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TableSettings {
    String table;
    String userIdColumn;
    String anonymousIdColumn;
    String timestampColumn;

    public String column(ColumnRole role) {
        return switch (role) {
            case USER_ID -> userIdColumn;
            case ANONYMOUS_ID -> anonymousIdColumn;
            case TIMESTAMP -> timestampColumn;
        };
    }
}
