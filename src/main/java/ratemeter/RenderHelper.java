package ratemeter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;

/**
 * Renders metric records for log lines and for export.
 *
 * <p>NaN and infinite values are written as-is
 */
public class RenderHelper {

  private static final Gson gson = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();

  /**
   * e.g. {@code MeterSnapshot{count=3, tenSecondRate=0.1188, ...}}
   */
  public static String toString(Object in) {
    return in.getClass().getSimpleName() + render(toJsonTree(in)).toString();
  }

  public static JsonElement toJsonTree(Object in) {
    return gson.toJsonTree(in);
  }

  public static String toJson(Object in) {
    return gson.toJson(in);
  }

  private static Object render(JsonElement jsonElement) {
    if (jsonElement.isJsonArray()) {
      List<Object> list = new ArrayList<>();
      jsonElement.getAsJsonArray().forEach(value -> list.add(render(value)));
      return list;
    }
    if (jsonElement.isJsonObject()) {
      Map<String, Object> fields = new LinkedHashMap<>();
      jsonElement.getAsJsonObject().entrySet().forEach(entry -> fields.put(entry.getKey(), render(entry.getValue())));
      return fields;
    }
    return jsonElement;
  }

}
