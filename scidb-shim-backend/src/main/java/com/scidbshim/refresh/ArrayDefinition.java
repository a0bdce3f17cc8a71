package com.scidbshim.refresh;

import lombok.Data;

/**
 * One entry of the arrays catalog: a table name and the AFL expression producing it.
 */
@Data
public class ArrayDefinition {
    private String name;
    private String afl;
}
