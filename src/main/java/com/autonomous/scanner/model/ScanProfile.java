package com.autonomous.scanner.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ScanProfile {
    private String name;
    private String description;

    // nmap arguments placed between the executable and the target
    private List<String> arguments = new ArrayList<>();

    // Bounds for the caller-supplied wait budget, in seconds
    private int minWaitSeconds = 5;
    private int maxWaitSeconds = 300;

    // custom profiles take a full command line instead of a target
    private boolean custom;

    // attach the scanner's raw stdout to the result
    private boolean keepRawOutput;
}
