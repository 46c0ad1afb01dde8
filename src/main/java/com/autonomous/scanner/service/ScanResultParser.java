package com.autonomous.scanner.service;

import com.autonomous.scanner.exception.ScanParseException;
import com.autonomous.scanner.model.HostInfo;
import com.autonomous.scanner.model.PortInfo;
import com.autonomous.scanner.model.ScanResult;
import com.autonomous.scanner.model.nmap.NmapAddress;
import com.autonomous.scanner.model.nmap.NmapHost;
import com.autonomous.scanner.model.nmap.NmapPort;
import com.autonomous.scanner.model.nmap.NmapRun;
import com.autonomous.scanner.model.nmap.NmapScript;
import com.autonomous.scanner.model.nmap.NmapService;
import com.autonomous.scanner.model.nmap.NmapState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.springframework.stereotype.Service;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns nmap's XML report into a {@link ScanResult}. Only the fields of the fixed
 * host/port schema are kept; any document whose root is not {@code nmaprun} is rejected.
 */
@Service
public class ScanResultParser {

    static final String UNKNOWN = "unknown";

    private final XmlMapper xmlMapper;

    public ScanResultParser() {
        this.xmlMapper = new XmlMapper();
        this.xmlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        XMLInputFactory inputFactory = xmlMapper.getFactory().getXMLInputFactory();
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
    }

    public ScanResult parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            throw new ScanParseException("Scanner produced no output", rawOutput);
        }

        NmapRun run;
        try {
            XMLStreamReader reader = xmlMapper.getFactory().getXMLInputFactory()
                .createXMLStreamReader(new StringReader(rawOutput));
            if (!advanceToRoot(reader)) {
                throw new ScanParseException("No XML root element in scanner output", rawOutput);
            }
            if (!NmapRun.ROOT_ELEMENT.equals(reader.getLocalName())) {
                throw new ScanParseException(
                    "Unexpected report root <" + reader.getLocalName() + ">", rawOutput);
            }
            run = xmlMapper.readValue(reader, NmapRun.class);
        } catch (XMLStreamException | IOException e) {
            throw new ScanParseException("Malformed scanner output", rawOutput, e);
        }

        List<HostInfo> hosts = new ArrayList<>();
        for (NmapHost host : run.getHosts()) {
            hosts.add(toHost(host));
        }

        return ScanResult.builder()
            .target(targetOf(run))
            .scanTime(scanTimeOf(run))
            .hosts(hosts)
            .build();
    }

    private boolean advanceToRoot(XMLStreamReader reader) throws XMLStreamException {
        while (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
            if (!reader.hasNext()) {
                return false;
            }
            reader.next();
        }
        return true;
    }

    private HostInfo toHost(NmapHost host) {
        List<PortInfo> ports = new ArrayList<>();
        if (host.getPorts() != null) {
            for (NmapPort port : host.getPorts().getEntries()) {
                ports.add(toPort(port));
            }
        }

        return HostInfo.builder()
            .address(addressOf(host))
            .status(stateOf(host.getStatus()))
            .hostname(hostnameOf(host))
            .ports(ports)
            .build();
    }

    private PortInfo toPort(NmapPort port) {
        NmapService service = port.getService();
        String name = null;
        String version = null;
        if (service != null) {
            name = emptyToNull(service.getName());
            String joined = (nullToEmpty(service.getProduct()) + " " + nullToEmpty(service.getVersion())).trim();
            version = emptyToNull(joined);
        }

        return PortInfo.builder()
            .port(port.getPortid() != null ? port.getPortid() : 0)
            .protocol(port.getProtocol() != null ? port.getProtocol() : "tcp")
            .state(stateOf(port.getState()))
            .service(name)
            .version(version)
            .scripts(scriptsOf(port))
            .build();
    }

    private Map<String, String> scriptsOf(NmapPort port) {
        if (port.getScripts().isEmpty()) {
            return null;
        }
        Map<String, String> scripts = new LinkedHashMap<>();
        for (NmapScript script : port.getScripts()) {
            if (script.getId() != null) {
                scripts.put(script.getId(), nullToEmpty(script.getOutput()));
            }
        }
        return scripts.isEmpty() ? null : scripts;
    }

    // IPv4 wins; IPv6 is the fallback; MAC addresses are never the host address
    private String addressOf(NmapHost host) {
        String address = UNKNOWN;
        for (NmapAddress candidate : host.getAddresses()) {
            if ("ipv4".equals(candidate.getAddrtype()) && candidate.getAddr() != null) {
                return candidate.getAddr();
            }
            if ("ipv6".equals(candidate.getAddrtype()) && candidate.getAddr() != null) {
                address = candidate.getAddr();
            }
        }
        return address;
    }

    private String hostnameOf(NmapHost host) {
        if (host.getHostnames() == null || host.getHostnames().getEntries().isEmpty()) {
            return null;
        }
        return emptyToNull(host.getHostnames().getEntries().get(0).getName());
    }

    private String targetOf(NmapRun run) {
        String args = run.getArgs();
        if (args == null || args.isBlank()) {
            return UNKNOWN;
        }
        String[] parts = args.trim().split("\\s+");
        return parts[parts.length - 1];
    }

    private String scanTimeOf(NmapRun run) {
        if (run.getRunstats() == null || run.getRunstats().getFinished() == null) {
            return UNKNOWN;
        }
        String elapsed = run.getRunstats().getFinished().getElapsed();
        return elapsed != null ? elapsed + "s" : UNKNOWN;
    }

    private String stateOf(NmapState state) {
        return state != null && state.getState() != null ? state.getState() : UNKNOWN;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
