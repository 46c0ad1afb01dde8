package com.autonomous.scanner.model.nmap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NmapRunStats {

    private Finished finished;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Finished {
        @JacksonXmlProperty(isAttribute = true)
        private String elapsed;
    }
}
