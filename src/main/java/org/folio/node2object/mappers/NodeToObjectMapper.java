package org.folio.node2object.mappers;

import static org.folio.node2object.Constants.ATTRIBUTE_PREFIX;
import static org.folio.node2object.Constants.TEXT_KEY;
import static org.folio.node2object.processors.TextValueParser.parseText;
import static org.folio.node2object.processors.TextValueParser.parseTextContents;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.folio.node2object.domain.NodeType;
import org.folio.node2object.domain.XmlElement;

/**
 * Converts XML elements to JSON following the "@attribute" / "#text" convention. Repeated sibling
 * elements with the same tag are collected into an array.
 */
public class NodeToObjectMapper implements Mapper {

  private static final Logger logger = LogManager.getLogger(NodeToObjectMapper.class);

  /**
   * Wraps the converted root under its own tag name. A semi-structured root is mapped to null.
   *
   * @param root {@inheritDoc}
   * @return {@inheritDoc}
   */
  @Override
  public JsonObject convert(XmlElement root) {
    Objects.requireNonNull(root, "Root element is required");
    StopWatch timer = logger.isDebugEnabled() ? StopWatch.createStarted() : null;
    try {
      return new JsonObject().put(root.getName(), convertNode(root));
    } finally {
      if (timer != null) {
        timer.stop();
        logger.debug("Element '{}' converted to json after {} ms.", root.getName(),
            timer.getTime());
      }
    }
  }

  /**
   * Converts a single element according to its {@link NodeType}.
   *
   * @param element element to convert
   * @return {@link JsonObject}, {@link Double}, {@link Boolean}, {@link String}, or null. Null is
   *     returned for {@link NodeType#EMPTY} elements (JSON null) and for
   *     {@link NodeType#SEMI_STRUCTURED} ones, which produce no value.
   */
  public Object convertNode(XmlElement element) {
    return convertNode(element, NodeType.scan(element));
  }

  private Object convertNode(XmlElement element, NodeType nodeType) {
    switch (nodeType) {
      case EMPTY:
        return null;
      case TEXT:
        return parseTextContents(element);
      case ATTRIBUTES:
        return attributesToJson(element);
      case TEXT_AND_ATTRIBUTES:
        return attributesToJson(element).put(TEXT_KEY, parseTextContents(element));
      case PARENT:
        return foldChildren(element);
      case SEMI_STRUCTURED:
      default:
        logger.debug("Element '{}' mixes text with child elements, skipped.", element.getName());
        return null;
    }
  }

  private JsonObject attributesToJson(XmlElement element) {
    JsonObject data = new JsonObject();
    for (Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
      data.put(ATTRIBUTE_PREFIX + attribute.getKey(), parseText(attribute.getValue()));
    }
    return data;
  }

  private JsonObject foldChildren(XmlElement element) {
    JsonObject data = attributesToJson(element);
    Set<String> firstPass = new HashSet<>();
    Set<String> vectorized = new HashSet<>();

    for (XmlElement child : element.getChildren()) {
      NodeType childType = NodeType.scan(child);
      if (!childType.isConvertible()) {
        logger.debug("Element '{}' mixes text with child elements, skipped.", child.getName());
        continue;
      }
      String name = child.getName();
      Object value = convertNode(child, childType);
      if (firstPass.add(name)) {
        data.put(name, value);
      } else if (vectorized.add(name)) {
        // put on an existing key keeps its position
        data.put(name, new JsonArray().add(data.getValue(name)).add(value));
      } else {
        data.getJsonArray(name).add(value);
      }
    }
    return data;
  }
}
