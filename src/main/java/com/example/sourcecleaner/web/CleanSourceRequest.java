package com.example.sourcecleaner.web;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class CleanSourceRequest {
    private String fileName = "source.py";
    private String source;
    private List<String> imports = new ArrayList<>();
    private boolean removeAllUnusedImports;
    private boolean removeUnusedVariables;
    private Integer contextSize;
}
