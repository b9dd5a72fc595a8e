package com.servicevault.identifier.app.client;

@FunctionalInterface
public interface SurfaceListener {

  void onChange(IdentifierSurface surface);
}
