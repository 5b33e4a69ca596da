package org.folio.node2object.domain;

import static org.apache.commons.collections4.CollectionUtils.isEmpty;
import static org.apache.commons.collections4.MapUtils.isEmpty;

/**
 * Shape of an XML element, derived from its children, text/CDATA and attributes. The shape selects
 * how the element is converted to JSON.
 */
public enum NodeType {
  /** No children, no text, no attributes. */
  EMPTY,
  /** Only text and/or CDATA. */
  TEXT,
  /** Only attributes. */
  ATTRIBUTES,
  TEXT_AND_ATTRIBUTES,
  /** Child elements without any text; attributes allowed. */
  PARENT,
  /** Child elements mixed with text. Such elements are not converted. */
  SEMI_STRUCTURED;

  public static NodeType scan(XmlElement element) {
    if (isEmpty(element.getChildren())) {
      if (!element.hasTextContent()) {
        return isEmpty(element.getAttributes()) ? EMPTY : ATTRIBUTES;
      }
      return isEmpty(element.getAttributes()) ? TEXT : TEXT_AND_ATTRIBUTES;
    }
    return element.hasTextContent() ? SEMI_STRUCTURED : PARENT;
  }

  public boolean isConvertible() {
    return this != SEMI_STRUCTURED;
  }
}
