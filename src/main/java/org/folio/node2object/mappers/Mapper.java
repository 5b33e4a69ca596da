package org.folio.node2object.mappers;

import io.vertx.core.json.JsonObject;
import org.folio.node2object.domain.XmlElement;

/**
 * Converts an XML element tree to a JSON object.
 */
public interface Mapper {
  /**
   * Converts the root element of a document.
   *
   * @param root root element of the parsed document.
   * @return JSON object with a single key, the root's tag name.
   */
  JsonObject convert(XmlElement root);
}
