package info.isaksson.erland.docxparts.opc;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * DOM helpers shared by all XML parts: hardened parsing, serialization and new documents.
 */
public final class OxmlSupport {

    private static final DocumentBuilderFactory DBF = createFactory();

    private OxmlSupport() {}

    public static Document parse(byte[] xml, PartName partName) throws IOException {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        return parse(new ByteArrayInputStream(xml), partName);
    }

    public static Document parse(InputStream in, PartName partName) throws IOException {
        try {
            return newBuilder().parse(in);
        } catch (SAXException e) {
            throw new IOException("malformed XML in " + (partName == null ? "part" : partName) + ": " + e.getMessage(), e);
        }
    }

    /** Loads an XML template bundled on the classpath of {@code owner}. */
    public static Document template(Class<?> owner, String resource) throws IOException {
        try (InputStream in = owner.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("template not found on classpath: " + resource);
            return parse(in, null);
        }
    }

    public static Document newDocument() {
        return newBuilder().newDocument();
    }

    /** New document whose root element is {@code qualifiedName} in {@code nsUri}. */
    public static Document newDocument(String nsUri, String qualifiedName) {
        Document doc = newDocument();
        Element root = doc.createElementNS(nsUri, qualifiedName);
        doc.appendChild(root);
        return doc;
    }

    /** Serialize to UTF-8 with a standalone XML declaration. */
    public static byte[] serialize(Document doc) {
        try {
            Transformer t = TransformerFactory.newInstance().newTransformer();
            t.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            t.setOutputProperty(OutputKeys.INDENT, "no");
            doc.setXmlStandalone(true);
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            t.transform(new DOMSource(doc), new StreamResult(baos));
            return baos.toByteArray();
        } catch (TransformerException e) {
            throw new IllegalStateException("XML serialization failed", e);
        }
    }

    /** First direct child element of {@code parent} with the given namespace and local name, or {@code null}. */
    public static Element firstChild(Element parent, String nsUri, String localName) {
        for (org.w3c.dom.Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element el && nsUri.equals(el.getNamespaceURI()) && localName.equals(el.getLocalName())) {
                return el;
            }
        }
        return null;
    }

    private static DocumentBuilder newBuilder() {
        try {
            return DBF.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setExpandEntityReferences(false);
        try {
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("could not harden XML parser", e);
        }
        return dbf;
    }
}
