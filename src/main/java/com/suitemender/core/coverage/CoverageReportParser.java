package com.suitemender.core.coverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a Cobertura XML report as written by coverage.py ({@code coverage xml}).
 *
 *   <coverage line-rate="0.82">
 *     <packages><package><classes>
 *       <class filename="app/main.py">
 *         <lines><line number="14" hits="0"/></lines>
 */
@Component
public class CoverageReportParser {

    private static final Logger log = LoggerFactory.getLogger(CoverageReportParser.class);

    public CoverageMap parse(Path report) throws CoverageReportException {
        if (!Files.isRegularFile(report)) {
            throw new CoverageReportException("Coverage report not found: " + report);
        }
        try (InputStream in = Files.newInputStream(report)) {
            return parse(in);
        } catch (IOException e) {
            throw new CoverageReportException("Failed to read coverage report: " + report, e);
        }
    }

    public CoverageMap parse(String xml) throws CoverageReportException {
        return parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private CoverageMap parse(InputStream in) throws CoverageReportException {
        Document document;
        try {
            document = newBuilder().parse(in);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            throw new CoverageReportException("Malformed coverage report: " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        if (!"coverage".equals(root.getTagName())) {
            throw new CoverageReportException("Not a Cobertura report (root element <" + root.getTagName() + ">)");
        }

        Map<String, FileCoverage> files = new LinkedHashMap<>();
        NodeList classes = root.getElementsByTagName("class");
        for (int i = 0; i < classes.getLength(); i++) {
            Element classElement = (Element) classes.item(i);
            String filename = classElement.getAttribute("filename");
            if (filename.isEmpty()) continue;

            FileCoverage coverage = files.computeIfAbsent(
                    CoverageMap.normalize(filename), FileCoverage::new);

            NodeList lines = classElement.getElementsByTagName("line");
            for (int j = 0; j < lines.getLength(); j++) {
                Element line = (Element) lines.item(j);
                try {
                    coverage.record(
                            Integer.parseInt(line.getAttribute("number")),
                            Long.parseLong(line.getAttribute("hits")));
                } catch (NumberFormatException e) {
                    log.warn("[Coverage] Ignoring malformed <line> in {}: number='{}' hits='{}'",
                            filename, line.getAttribute("number"), line.getAttribute("hits"));
                }
            }
        }

        CoverageMap map = new CoverageMap(files, overallRate(root, files));
        log.info("[Coverage] Parsed {}", map);
        return map;
    }

    private static double overallRate(Element root, Map<String, FileCoverage> files) {
        String declared = root.getAttribute("line-rate");
        if (!declared.isEmpty()) {
            try {
                return Double.parseDouble(declared);
            } catch (NumberFormatException e) {
                log.warn("[Coverage] Unreadable line-rate '{}', recomputing from lines", declared);
            }
        }
        int covered = 0, total = 0;
        for (FileCoverage file : files.values()) {
            covered += file.getCoveredLines().size();
            total   += file.measuredLines();
        }
        return total == 0 ? 0.0 : (double) covered / total;
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        // coverage.py emits a DOCTYPE pointing at a remote DTD; never fetch it
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setExpandEntityReferences(false);
        return factory.newDocumentBuilder();
    }

    public static class CoverageReportException extends Exception {
        public CoverageReportException(String message)                  { super(message); }
        public CoverageReportException(String message, Throwable cause) { super(message, cause); }
    }
}
