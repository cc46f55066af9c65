package com.paxkun.binder.service.merge;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Well-formedness check for ComicInfo.xml payloads copied into a merged archive.
 * The content itself is never modified.
 */
@Slf4j
final class ComicInfoXml {

    static final String ENTRY_NAME = "ComicInfo.xml";
    private static final String ROOT_ELEMENT = "ComicInfo";

    private ComicInfoXml() {
    }

    static boolean isWellFormed(byte[] xml) {
        if (xml == null || xml.length == 0) {
            return false;
        }
        try {
            DocumentBuilder builder = secureFactory().newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            Document document = builder.parse(new ByteArrayInputStream(xml));
            return ROOT_ELEMENT.equals(document.getDocumentElement().getNodeName());
        } catch (SAXException | IOException e) {
            log.warn("⚠️ Ignoring malformed ComicInfo.xml: {}", e.getMessage());
            return false;
        } catch (ParserConfigurationException e) {
            log.warn("⚠️ XML parser unavailable, ComicInfo.xml will be omitted: {}", e.getMessage());
            return false;
        }
    }

    private static DocumentBuilderFactory secureFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }
}
