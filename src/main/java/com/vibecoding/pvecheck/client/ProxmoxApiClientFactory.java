package com.vibecoding.pvecheck.client;

import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.config.ProxmoxClientProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * 호스트마다 새 Proxmox 클라이언트를 만든다
 */
@Component
@RequiredArgsConstructor
public class ProxmoxApiClientFactory implements ClusterApiClientFactory {

    private final ProxmoxClientProperties properties;

    @Override
    public ClusterApiClient create(String host, ProbeOptions options) {
        SimpleClientHttpRequestFactory requestFactory = options.isInsecure()
                ? new InsecureClientHttpRequestFactory()
                : new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        return new ProxmoxApiClient(host, options, properties, new RestTemplate(requestFactory));
    }
}
