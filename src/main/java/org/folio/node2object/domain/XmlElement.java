package org.folio.node2object.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;

/**
 * In-memory XML element as handed over by the XML parser: tag name, optional text and CDATA,
 * attributes in document order and child elements in document order.
 */
@Getter
public class XmlElement {

  private final String name;
  private String text;
  private String cdata;
  private final Map<String, String> attributes = new LinkedHashMap<>();
  private final List<XmlElement> children = new ArrayList<>();

  public XmlElement(String name) {
    this.name = Objects.requireNonNull(name, "Element name is required");
  }

  public XmlElement setText(String text) {
    this.text = text;
    return this;
  }

  public XmlElement setCdata(String cdata) {
    this.cdata = cdata;
    return this;
  }

  /**
   * Adds an attribute. A second call with the same name replaces the value and keeps the original
   * position.
   */
  public XmlElement addAttribute(String attributeName, String value) {
    attributes.put(Objects.requireNonNull(attributeName), Objects.requireNonNull(value));
    return this;
  }

  public XmlElement addChild(XmlElement child) {
    children.add(Objects.requireNonNull(child));
    return this;
  }

  public Map<String, String> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public List<XmlElement> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public boolean hasTextContent() {
    return text != null || cdata != null;
  }

  @Override
  public String toString() {
    return "XmlElement{name='" + name + "', attributes=" + attributes.size()
        + ", children=" + children.size() + "}";
  }
}
