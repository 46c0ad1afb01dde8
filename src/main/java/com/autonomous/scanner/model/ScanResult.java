package com.autonomous.scanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResult {
    private String target;
    private String scanTime;

    @Builder.Default
    private List<HostInfo> hosts = new ArrayList<>();

    // scanner stdout as produced, kept for profiles that ask for it (custom scans)
    private String rawOutput;
}
