package com.servicevault.identifier.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Single-asset projection served to an asset sticker scan. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectedAsset {

  private Viewer.Kind viewer;
  private ProjectedView.AssetView asset;
  private List<ProjectedView.DocumentView> documents;
  private List<ProjectedView.TimelineEntry> timeline;
}
