package org.fuelroute.export;

import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.ingestion.GpxDocument;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Serializes a {@link GpxDocument} as GPX 1.1 (waypoints, then routes, then tracks).
 */
public final class GpxWriter {
    public static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";
    public static final String CREATOR = "fuel-route-optimizer";

    private final XMLOutputFactory factory = XMLOutputFactory.newInstance();

    public String write(GpxDocument document) {
        Objects.requireNonNull(document, "document");
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = factory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("gpx");
            xml.writeDefaultNamespace(GPX_NAMESPACE);
            xml.writeAttribute("version", "1.1");
            xml.writeAttribute("creator", CREATOR);

            for (GpxDocument.Waypoint waypoint : document.waypoints()) {
                xml.writeStartElement("wpt");
                writeCoordinates(xml, waypoint.location());
                writeOptional(xml, "name", waypoint.name());
                writeOptional(xml, "desc", waypoint.description());
                writeOptional(xml, "sym", waypoint.symbol());
                xml.writeEndElement();
            }
            for (GpxDocument.Route route : document.routes()) {
                xml.writeStartElement("rte");
                writeOptional(xml, "name", route.name());
                writePoints(xml, "rtept", route.points());
                xml.writeEndElement();
            }
            for (GpxDocument.Track track : document.tracks()) {
                xml.writeStartElement("trk");
                writeOptional(xml, "name", track.name());
                for (GpxDocument.Segment segment : track.segments()) {
                    xml.writeStartElement("trkseg");
                    writePoints(xml, "trkpt", segment.points());
                    xml.writeEndElement();
                }
                xml.writeEndElement();
            }

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException ex) {
            throw new IllegalStateException("GPX serialization failed", ex);
        }
        return out.toString();
    }

    public void write(GpxDocument document, Path file) {
        try {
            Files.writeString(file, write(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("cannot write GPX file " + file, ex);
        }
    }

    private static void writePoints(XMLStreamWriter xml, String element, List<GeoPoint> points) throws XMLStreamException {
        for (GeoPoint point : points) {
            xml.writeEmptyElement(element);
            writeCoordinates(xml, point);
        }
    }

    private static void writeCoordinates(XMLStreamWriter xml, GeoPoint point) throws XMLStreamException {
        xml.writeAttribute("lat", decimal(point.latitude()));
        xml.writeAttribute("lon", decimal(point.longitude()));
    }

    private static void writeOptional(XMLStreamWriter xml, String element, String text) throws XMLStreamException {
        if (text == null || text.isEmpty()) {
            return;
        }
        xml.writeStartElement(element);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }

    private static String decimal(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
