package com.autonomous.scanner.model.nmap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of an nmap XML report ({@code nmap -oX -}).
 *
 * <p>Repeated elements are collected through single-element setters so that
 * {@code host} entries interleaved with progress elements are all kept.
 */
@Data
@JacksonXmlRootElement(localName = NmapRun.ROOT_ELEMENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public class NmapRun {

    public static final String ROOT_ELEMENT = "nmaprun";

    @JacksonXmlProperty(isAttribute = true)
    private String args;

    private NmapRunStats runstats;

    @Setter(AccessLevel.NONE)
    private List<NmapHost> hosts = new ArrayList<>();

    @JsonSetter("host")
    public void addHost(NmapHost host) {
        if (host != null) {
            hosts.add(host);
        }
    }
}
