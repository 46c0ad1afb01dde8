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
public class NmapHost {

    private NmapState status;
    private Hostnames hostnames;
    private Ports ports;

    @Setter(AccessLevel.NONE)
    private List<NmapAddress> addresses = new ArrayList<>();

    @JsonSetter("address")
    public void addAddress(NmapAddress address) {
        if (address != null) {
            addresses.add(address);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hostnames {
        @Setter(AccessLevel.NONE)
        private List<Hostname> entries = new ArrayList<>();

        @JsonSetter("hostname")
        public void addHostname(Hostname hostname) {
            if (hostname != null) {
                entries.add(hostname);
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Hostname {
        @JacksonXmlProperty(isAttribute = true)
        private String name;

        @JacksonXmlProperty(isAttribute = true)
        private String type;  // user, PTR
    }

    // <extraports> summaries inside <ports> are ignored
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ports {
        @Setter(AccessLevel.NONE)
        private List<NmapPort> entries = new ArrayList<>();

        @JsonSetter("port")
        public void addPort(NmapPort port) {
            if (port != null) {
                entries.add(port);
            }
        }
    }
}
