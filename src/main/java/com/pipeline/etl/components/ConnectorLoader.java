package com.pipeline.etl.components;

import com.pipeline.etl.core.Loader;
import com.pipeline.etl.core.impl.ConnectorRegistry;
import com.pipeline.etl.exception.ConfigurationException;
import com.pipeline.etl.model.Dataset;

/**
 * 把加载委托给宿主注册的外部目标端连接器
 */
public class ConnectorLoader implements Loader {

    private final String connectorName;
    private final Loader connector;

    public ConnectorLoader(ConnectorRegistry registry, String connectorName) {
        this.connectorName = connectorName;
        this.connector = registry.getSink(connectorName);
        if (connector == null) {
            throw new ConfigurationException("No sink connector registered under '" + connectorName + "'");
        }
    }

    @Override
    public boolean load(Dataset data) throws Exception {
        return connector.load(data);
    }

    public String getConnectorName() { return connectorName; }
}
