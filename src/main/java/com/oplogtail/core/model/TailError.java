package com.oplogtail.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.oplogtail.core.util.JsonUtils;
import java.io.PrintWriter;
import java.io.Serial;
import java.io.Serializable;
import java.io.StringWriter;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TailError implements Serializable {

  @Serial private static final long serialVersionUID = 1L;

  private ErrorType errorType;
  private String errorMessage;
  private String source;
  private String namespace;
  private String documentId;
  private Instant timestamp;
  private String stacktrace;

  @JsonIgnore private transient Throwable cause;

  public static TailError of(
      ErrorType errorType, String source, String errorMessage, Operation operation, Throwable cause) {
    return TailError.builder()
        .errorType(errorType)
        .errorMessage(errorMessage)
        .source(source)
        .namespace(operation != null ? String.valueOf(operation.getNamespace()) : null)
        .documentId(
            operation != null && operation.getDocumentId() != null
                ? String.valueOf(operation.getDocumentId())
                : null)
        .timestamp(Instant.now())
        .stacktrace(cause != null ? stacktraceToString(cause) : null)
        .cause(cause)
        .build();
  }

  public static TailError of(ErrorType errorType, String source, String errorMessage, Throwable cause) {
    return of(errorType, source, errorMessage, null, cause);
  }

  @JsonIgnore
  public boolean isFatal() {
    return errorType == ErrorType.FATAL;
  }

  private static String stacktraceToString(Throwable t) {
    var sw = new StringWriter();
    t.printStackTrace(new PrintWriter(sw));
    return sw.toString();
  }

  public String toJson() {
    return JsonUtils.toJson(this);
  }
}
