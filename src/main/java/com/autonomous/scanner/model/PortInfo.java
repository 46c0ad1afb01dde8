package com.autonomous.scanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PortInfo {
    private int port;
    private String protocol;
    private String state;   // open, closed, filtered, ...
    private String service;
    private String version;

    // NSE script id -> output, only when scripts ran against the port
    private Map<String, String> scripts;
}
