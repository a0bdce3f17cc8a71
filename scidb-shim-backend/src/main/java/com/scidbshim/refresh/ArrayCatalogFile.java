package com.scidbshim.refresh;

import lombok.Data;

import java.util.List;

@Data
public class ArrayCatalogFile {
    private List<ArrayDefinition> arrays;
}
