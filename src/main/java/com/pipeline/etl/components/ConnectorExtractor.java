package com.pipeline.etl.components;

import com.pipeline.etl.core.Extractor;
import com.pipeline.etl.core.impl.ConnectorRegistry;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.Dataset;

/**
 * 把抽取委托给宿主注册的外部数据源连接器
 */
public class ConnectorExtractor implements Extractor {

    private final String connectorName;
    private final Extractor connector;

    public ConnectorExtractor(ConnectorRegistry registry, String connectorName) {
        this.connectorName = connectorName;
        this.connector = registry.getSource(connectorName);
        if (connector == null) {
            throw new ConfigurationException("No source connector registered under '" + connectorName + "'");
        }
    }

    @Override
    public Dataset extract() throws Exception {
        Dataset data = connector.extract();
        if (data == null) {
            throw new IllegalStateException("Source connector '" + connectorName + "' returned no dataset");
        }
        return data;
    }

    public String getConnectorName() { return connectorName; }
}
