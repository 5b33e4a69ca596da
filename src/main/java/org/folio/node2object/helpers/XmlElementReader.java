package org.folio.node2object.helpers;

import static org.apache.commons.lang3.StringUtils.isBlank;
import static org.apache.commons.lang3.StringUtils.isEmpty;
import static org.apache.commons.lang3.StringUtils.strip;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import lombok.extern.log4j.Log4j2;
import org.folio.node2object.domain.XmlElement;

/**
 * Builds {@link XmlElement} trees from XML documents using the JDK StAX parser. Attributes keep
 * document order and CDATA sections are kept apart from text.
 *
 * <p>Text of an element is the concatenation of its text chunks with leading and trailing
 * whitespace stripped, so pretty-printed {@code <h>\n  173.5\n</h>} reads as {@code 173.5}.
 * Text that is whitespace only, like indentation between child elements, is dropped. CDATA is
 * taken verbatim.
 *
 * <p>The factory is configured once; every {@link #read(InputStream)} creates its own stream
 * reader, so one instance can be shared between threads.
 */
@Log4j2
public class XmlElementReader {

  private static final String REPORT_CDATA_EVENT =
      "http://java.sun.com/xml/stream/properties/report-cdata-event";
  private static final String PARSING_ERROR_MESSAGE = "Can't parse xml.";

  private final XMLInputFactory inputFactory;

  public XmlElementReader() {
    inputFactory = XMLInputFactory.newFactory();
    inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
    // CDATA sections must stay separate from text
    inputFactory.setProperty(XMLInputFactory.IS_COALESCING, false);
    if (inputFactory.isPropertySupported(REPORT_CDATA_EVENT)) {
      inputFactory.setProperty(REPORT_CDATA_EVENT, true);
    }
  }

  public XmlElement read(String source) {
    return read(source.getBytes(StandardCharsets.UTF_8));
  }

  public XmlElement read(byte[] source) {
    return read(new ByteArrayInputStream(source));
  }

  /**
   * Parses a whole document and returns its root element.
   *
   * @param source XML document
   * @return root element
   * @throws IllegalStateException if the document can't be parsed
   */
  public XmlElement read(InputStream source) {
    XMLStreamReader reader = null;
    try {
      reader = inputFactory.createXMLStreamReader(source);
      while (reader.next() != XMLStreamConstants.START_ELEMENT) {
        // prolog: declaration, comments, processing instructions
      }
      return readElement(reader);
    } catch (XMLStreamException e) {
      log.error("Xml document can't be parsed: {}", e.getMessage());
      throw new IllegalStateException(PARSING_ERROR_MESSAGE, e);
    } finally {
      close(reader);
    }
  }

  /**
   * Reads the element the reader is positioned on, up to and including its end tag.
   */
  private XmlElement readElement(XMLStreamReader reader) throws XMLStreamException {
    XmlElement element = new XmlElement(qualifiedName(reader.getName()));
    for (int i = 0; i < reader.getAttributeCount(); i++) {
      element.addAttribute(qualifiedName(reader.getAttributeName(i)),
          reader.getAttributeValue(i));
    }

    StringBuilder text = null;
    StringBuilder cdata = null;
    while (true) {
      switch (reader.next()) {
        case XMLStreamConstants.START_ELEMENT:
          element.addChild(readElement(reader));
          break;
        case XMLStreamConstants.CDATA:
          cdata = (cdata == null ? new StringBuilder() : cdata).append(reader.getText());
          break;
        case XMLStreamConstants.CHARACTERS:
          // one text run may arrive in several chunks, e.g. around entity references
          text = (text == null ? new StringBuilder() : text).append(reader.getText());
          break;
        case XMLStreamConstants.END_ELEMENT:
          if (text != null && !isBlank(text)) {
            element.setText(strip(text.toString()));
          }
          if (cdata != null) {
            element.setCdata(cdata.toString());
          }
          return element;
        default:
          break;
      }
    }
  }

  private static String qualifiedName(QName name) {
    String localPart = name.getLocalPart();
    if (isEmpty(name.getPrefix()) || localPart.indexOf(':') >= 0) {
      return localPart;
    }
    return name.getPrefix() + ":" + localPart;
  }

  private static void close(XMLStreamReader reader) {
    if (reader == null) {
      return;
    }
    try {
      reader.close();
    } catch (XMLStreamException e) {
      log.warn("Xml stream reader can't be closed: {}", e.getMessage());
    }
  }
}
