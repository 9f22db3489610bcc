package com.riskscan.connect.config;

import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProviderHttpConfig {

    @Bean
    public HttpTransport providerHttpTransport() {
        return new NetHttpTransport();
    }

    @Bean
    public JsonFactory providerJsonFactory() {
        return GsonFactory.getDefaultInstance();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
