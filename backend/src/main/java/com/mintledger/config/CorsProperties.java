package com.mintledger.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Browser origins allowed to call the API.
 */
@ConfigurationProperties(prefix = "mintledger.cors")
@NoArgsConstructor
@Getter
@Setter
public class CorsProperties {

    private List<String> allowedOrigins = new ArrayList<>(List.of(
            "http://localhost:9002",
            "https://enb-onchain-summer.vercel.app"));
}
