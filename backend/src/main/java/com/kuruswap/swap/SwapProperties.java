package com.kuruswap.swap;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kuruswap.swap")
@NoArgsConstructor
@Getter
@Setter
public class SwapProperties {

    /** Router contract exposing anyToAnySwap. */
    private String routerAddress = "0xc816865f172d640d93712C68a7E1F83F3fA63235";
}
