package org.carball.slowq.model.schema;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Column {
    private String name;
    private String dataType;
    private boolean nullable;
    private boolean primaryKey;
    private boolean autoIncrement;
    private String defaultValue;
}
