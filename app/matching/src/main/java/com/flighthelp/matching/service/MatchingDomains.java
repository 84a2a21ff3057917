/*
 * どこで: Matching サービス層
 * 何を: domain から照合ルールと Repository の組を引く
 * なぜ: 各 Service が domain ごとの分岐を持たずに済むようにするため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.model.ServiceDomain;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class MatchingDomains {

  private final Map<ServiceDomain, DomainBinding<?, ?>> bindings =
      new EnumMap<>(ServiceDomain.class);

  public MatchingDomains(List<DomainBinding<?, ?>> bindings) {
    for (DomainBinding<?, ?> binding : bindings) {
      if (this.bindings.putIfAbsent(binding.domain(), binding) != null) {
        throw new IllegalArgumentException("duplicate binding for domain " + binding.domain());
      }
    }
  }

  public DomainBinding<?, ?> get(ServiceDomain domain) {
    final DomainBinding<?, ?> binding = bindings.get(domain);
    if (binding == null) {
      throw new IllegalArgumentException("unsupported domain: " + domain);
    }
    return binding;
  }

  public Collection<DomainBinding<?, ?>> all() {
    return Collections.unmodifiableCollection(bindings.values());
  }
}
