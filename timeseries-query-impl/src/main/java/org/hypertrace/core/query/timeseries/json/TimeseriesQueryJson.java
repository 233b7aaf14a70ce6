package org.hypertrace.core.query.timeseries.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryRequest;
import org.hypertrace.core.query.timeseries.api.TimeseriesQueryResponse;

/** JSON binding of the request and response documents exchanged with the UI. */
public class TimeseriesQueryJson {

  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private TimeseriesQueryJson() {}

  public static TimeseriesQueryRequest readRequest(String json) throws JsonProcessingException {
    return OBJECT_MAPPER.readValue(json, TimeseriesQueryRequest.class);
  }

  public static String writeResponse(TimeseriesQueryResponse response)
      throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(response);
  }
}
