package com.servicevault.identifier.app.service;

/** Produces short-lived download links for stored documents. */
public interface DocumentLinkSigner {

  /**
   * @param path storage key of the document
   * @return a download URL, or {@code null} when no link can be produced
   */
  String downloadUrl(String path);

  /** Signer for deployments without document storage. */
  static DocumentLinkSigner none() {
    return path -> null;
  }
}
