package org.autofetch.config.utils;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.Unmarshaller;
import org.w3c.dom.Document;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class XmlUtil {

    private XmlUtil() {}

    /**
     * Parses an XML file into a DOM document. DOCTYPE declarations are rejected,
     * so external entities are never resolved.
     */
    public static Document readDocument(Path path) throws Exception {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(false);
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setExpandEntityReferences(false);
        DocumentBuilder db = dbf.newDocumentBuilder();
        try (InputStream is = Files.newInputStream(path)) {
            return db.parse(is);
        }
    }

    /**
     * Convert XML → Java object.
     * Throws Exception: caller must handle or propagate (e.g. invalid XML).
     */
    @SuppressWarnings("unchecked")
    public static <T> T unmarshal(Document xmlDoc, Class<T> type) throws Exception {
        JAXBContext ctx = JAXBContext.newInstance(type);
        Unmarshaller um = ctx.createUnmarshaller();
        return (T) um.unmarshal(xmlDoc);
    }
}
