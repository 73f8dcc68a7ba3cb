package com.routedoc.service.impl;

import com.routedoc.model.RouteTable;
import com.routedoc.service.api.RouteTableService;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * An in-memory {@link RouteTableService}.
 */
@Service
@Slf4j
public class RouteTableServiceImpl implements RouteTableService {

    private volatile RouteTable routeTable;
    private volatile String source;

    @Override
    public synchronized void setRouteTable(String source, RouteTable table) {
        if (this.routeTable != null) {
            log.info("Replacing route table from {} with {} routes from {}", this.source, table.size(), source);
        }
        this.routeTable = table;
        this.source = source;
    }

    @Override
    public Optional<RouteTable> getRouteTable() {
        return Optional.ofNullable(routeTable);
    }

    @Override
    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }
}
