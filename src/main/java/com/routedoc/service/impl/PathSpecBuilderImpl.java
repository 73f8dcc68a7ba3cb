package com.routedoc.service.impl;

import com.routedoc.model.ParameterSpec;
import com.routedoc.model.ParsedPath;
import com.routedoc.model.RouteSegment;
import com.routedoc.service.api.PathSpecBuilder;
import com.routedoc.service.api.RouteTemplateParser;
import com.routedoc.service.support.ConverterArgumentParser;
import com.routedoc.service.support.ConverterSchemaTable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class PathSpecBuilderImpl implements PathSpecBuilder {

    private final RouteTemplateParser routeTemplateParser;

    public PathSpecBuilderImpl(RouteTemplateParser routeTemplateParser) {
        this.routeTemplateParser = routeTemplateParser;
    }

    @Override
    public ParsedPath build(String rule) {
        StringBuilder path = new StringBuilder();
        List<ParameterSpec> parameters = new ArrayList<>();

        routeTemplateParser.parse(rule).forEach(segment -> {
            if (segment instanceof RouteSegment.Static) {
                path.append(((RouteSegment.Static) segment).text());
                return;
            }
            RouteSegment.Dynamic dynamic = (RouteSegment.Dynamic) segment;
            path.append('{').append(dynamic.variable()).append('}');
            var arguments = ConverterArgumentParser.parse(rule, dynamic.arguments());
            parameters.add(ParameterSpec.path(dynamic.variable(), ConverterSchemaTable.schemaFor(dynamic.converter(), arguments)));
        });

        return new ParsedPath(path.toString(), Collections.unmodifiableList(parameters));
    }
}
