package com.ivamare.ogcapi.web;

import com.ivamare.ogcapi.model.Link;
import com.ivamare.ogcapi.model.LinkRel;

import java.util.List;

/**
 * Landing page and conformance resources.
 */
public class CoreApiModule implements ApiModule {

    public static final String COMMON_CORE = "http://www.opengis.net/spec/ogcapi-common-1/1.0/conf/core";

    @Override
    public List<Link> landingLinks(ApiLinks links) {
        return List.of(
            Link.of(links.root(), LinkRel.SELF).withTitle("this document"),
            Link.of(links.conformance(), LinkRel.CONFORMANCE).withTitle("conformance classes implemented by this server")
        );
    }

    @Override
    public List<String> conformanceClasses() {
        return List.of(COMMON_CORE);
    }
}
