package com.flighthelp.matching.service;

import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.repository.HelpMatchRepository;
import com.flighthelp.matching.scoring.MatchingPolicy;

/** 同じ domain の照合ルールと永続化をひと組にしたもの。 */
public record DomainBinding<R extends HelpRequest, O extends HelpOffer>(
    MatchingPolicy<R, O> policy, HelpMatchRepository<R, O> repository) {

  public DomainBinding {
    if (policy.domain() != repository.domain()) {
      throw new IllegalArgumentException(
          "domain mismatch: policy=" + policy.domain() + " repository=" + repository.domain());
    }
  }

  public ServiceDomain domain() {
    return policy.domain();
  }
}
