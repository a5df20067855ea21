package com.my.offers.adapter.out.llm;

import com.my.offers.domain.port.out.OfferRewritePort;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

@DefaultBean
@ApplicationScoped
public class PassthroughRewriteAdapter implements OfferRewritePort {

    @Override
    public String rewrite(String originalText) {
        return originalText;
    }
}
