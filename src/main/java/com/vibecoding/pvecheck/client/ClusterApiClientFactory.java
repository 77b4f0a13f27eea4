package com.vibecoding.pvecheck.client;

import com.vibecoding.pvecheck.config.ProbeOptions;

public interface ClusterApiClientFactory {

    ClusterApiClient create(String host, ProbeOptions options);
}
