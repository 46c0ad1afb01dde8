package com.autonomous.scanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {
    private String target;   // quick and full scans
    private String command;  // custom scans: nmap arguments and target
    private Integer timeout; // seconds to wait synchronously
}
