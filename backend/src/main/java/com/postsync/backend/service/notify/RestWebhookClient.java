package com.postsync.backend.service.notify;

import com.postsync.backend.config.PostSyncProperties;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class RestWebhookClient implements WebhookClient {

    private final RestClient restClient;

    public RestWebhookClient(RestClient.Builder builder, PostSyncProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.notifications().timeout());
        factory.setReadTimeout(props.notifications().timeout());
        this.restClient = builder.requestFactory(factory).build();
    }

    @Override
    public void deliver(String url, String jsonBody) {
        restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Postsync-Event", "post.changed")
                .body(jsonBody)
                .retrieve()
                .toBodilessEntity();
    }
}
