package com.autonomous.scanner.model.nmap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NmapPort {
    @JacksonXmlProperty(isAttribute = true)
    private String protocol;

    @JacksonXmlProperty(isAttribute = true)
    private Integer portid;

    private NmapState state;
    private NmapService service;

    @Setter(AccessLevel.NONE)
    private List<NmapScript> scripts = new ArrayList<>();

    @JsonSetter("script")
    public void addScript(NmapScript script) {
        if (script != null) {
            scripts.add(script);
        }
    }
}
