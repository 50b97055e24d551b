package org.fuelroute.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads GPX 1.0/1.1 files into a {@link GpxDocument}.
 *
 * <p>Element matching ignores namespaces. Bytes are decoded as UTF-8 and re-decoded as
 * ISO-8859-1 when they are not valid UTF-8, which covers files exported by older GPS tools.</p>
 */
@Slf4j
public final class GpxTrackReader {

    /**
     * Loads the path of a GPX file.
     *
     * @throws TrackValidationException when the file is unreadable or has fewer than 2 points.
     */
    public GeoPath load(Path file) {
        GeoPath path = read(file).toPath();
        log.info("GPX {} loaded: {} points", file.getFileName(), path.size());
        return path;
    }

    public GpxDocument read(Path file) {
        Objects.requireNonNull(file, "file");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_UNREADABLE, "cannot read GPX file " + file, ex);
        }
        return read(bytes);
    }

    public GpxDocument read(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        Document document = parse(decode(bytes));
        Element root = document.getDocumentElement();
        if (root == null || !"gpx".equals(localName(root))) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_UNREADABLE, "document root is not a <gpx> element");
        }

        List<GpxDocument.Track> tracks = new ArrayList<>();
        for (Element trk : children(root, "trk")) {
            List<GpxDocument.Segment> segments = new ArrayList<>();
            for (Element trkseg : children(trk, "trkseg")) {
                segments.add(new GpxDocument.Segment(points(trkseg, "trkpt")));
            }
            tracks.add(new GpxDocument.Track(childText(trk, "name"), segments));
        }
        List<GpxDocument.Route> routes = new ArrayList<>();
        for (Element rte : children(root, "rte")) {
            routes.add(new GpxDocument.Route(childText(rte, "name"), points(rte, "rtept")));
        }
        List<GpxDocument.Waypoint> waypoints = new ArrayList<>();
        for (Element wpt : children(root, "wpt")) {
            waypoints.add(new GpxDocument.Waypoint(
                    point(wpt), childText(wpt, "name"), childText(wpt, "desc"), childText(wpt, "sym")));
        }
        return new GpxDocument(tracks, routes, waypoints);
    }

    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            log.debug("GPX bytes are not valid UTF-8, decoding as ISO-8859-1");
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private static Document parse(String xml) {
        String content = xml.startsWith("\uFEFF") ? xml.substring(1) : xml;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(null);
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (ParserConfigurationException | SAXException | IOException ex) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_UNREADABLE, "malformed GPX document: " + ex.getMessage(), ex);
        }
    }

    private static List<GeoPoint> points(Element parent, String elementName) {
        List<GeoPoint> points = new ArrayList<>();
        for (Element element : children(parent, elementName)) {
            points.add(point(element));
        }
        return points;
    }

    private static GeoPoint point(Element element) {
        String lat = element.getAttribute("lat");
        String lon = element.getAttribute("lon");
        try {
            return new GeoPoint(Double.parseDouble(lat.trim()), Double.parseDouble(lon.trim()));
        } catch (IllegalArgumentException ex) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_UNREADABLE,
                    "invalid <" + localName(element) + "> coordinates lat='" + lat + "' lon='" + lon + "'",
                    ex
            );
        }
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> matches = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node))) {
                matches.add((Element) node);
            }
        }
        return matches;
    }

    private static String childText(Element parent, String name) {
        List<Element> matches = children(parent, name);
        return matches.isEmpty() ? "" : matches.get(0).getTextContent().trim();
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }
}
