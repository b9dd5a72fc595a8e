package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The field-filtered view of a property returned to one viewer. Stripped fields are absent from
 * the JSON (never masked).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectedView {

  private Viewer.Kind viewer;
  private PropertyView property;
  private List<AssetView> assets;
  private List<DocumentView> documents;
  private List<TimelineEntry> timeline;

  /** Owner only. */
  private PrivacySettings privacySettings;

  /** Owner only: whether the settings may currently be edited. */
  private Boolean settingsEditable;

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class PropertyView {
    private String id;
    private String name;
    private String type;
    private Address address;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @Builder(toBuilder = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class AssetView {
    private String id;
    private String name;
    private String category;
    private String brand;
    private String model;
    private String serial;
    private Instant installedAt;
    private String status;

    /** Owner only, so the owner UI can tell public from private assets. */
    private AssetType assetType;

    private String installerId;
    private BigDecimal purchasePrice;

    /** Disclosable history, newest first; empty rather than absent. */
    private List<EventView> history;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class EventView {
    private String id;
    private String assetId;
    private String type;
    private Map<String, Object> data;
    private String createdBy;
    private BigDecimal amount;
    private Instant createdAt;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @Builder(toBuilder = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class DocumentView {
    private String id;
    private String assetId;
    private String type;
    private String title;
    private String uploadedBy;
    private BigDecimal amount;
    private LocalDate issueDate;
    private LocalDate expiryDate;
    private Instant uploadedAt;

    /** Short-lived download link from the document storage subsystem, if it issues one. */
    private String downloadUrl;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class TimelineEntry {
    public enum Kind {
      EVENT,
      DOCUMENT
    }

    private Kind kind;
    private Instant date;
    private String refId;
    private String assetId;
    private String label;
  }
}
