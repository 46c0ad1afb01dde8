package com.autonomous.scanner.model.nmap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;

// <status state="up"/> on hosts, <state state="open"/> on ports
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NmapState {
    @JacksonXmlProperty(isAttribute = true)
    private String state;
}
