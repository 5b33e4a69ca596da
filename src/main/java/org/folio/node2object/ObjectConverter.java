package org.folio.node2object;

import static org.folio.node2object.Constants.JSON_FORMATTED_OUTPUT;

import io.vertx.core.json.JsonObject;
import org.folio.node2object.domain.XmlElement;
import org.folio.node2object.helpers.XmlElementReader;
import org.folio.node2object.mappers.Mapper;
import org.folio.node2object.mappers.NodeToObjectMapper;

/**
 * Parses XML, converts it with {@link NodeToObjectMapper} and encodes the result as JSON text.
 */
public class ObjectConverter {

  private static final ObjectConverter ourInstance = new ObjectConverter();

  private final XmlElementReader reader;
  private final Mapper mapper;

  public static ObjectConverter getInstance() {
    return ourInstance;
  }

  ObjectConverter() {
    this(new XmlElementReader(), new NodeToObjectMapper());
  }

  ObjectConverter(XmlElementReader reader, Mapper mapper) {
    this.reader = reader;
    this.mapper = mapper;
  }

  public JsonObject convert(byte[] xml) {
    return mapper.convert(reader.read(xml));
  }

  public String convertToString(byte[] xml) {
    return encode(convert(xml));
  }

  public String convertToString(XmlElement root) {
    return encode(mapper.convert(root));
  }

  private String encode(JsonObject json) {
    // Pretty printing is off unless the property is set
    return Boolean.parseBoolean(System.getProperty(JSON_FORMATTED_OUTPUT))
        ? json.encodePrettily() : json.encode();
  }
}
