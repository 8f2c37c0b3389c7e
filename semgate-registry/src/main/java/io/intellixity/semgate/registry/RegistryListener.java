package io.intellixity.semgate.registry;

@FunctionalInterface
public interface RegistryListener {
  void onEvent(RegistryEvent event);
}
