package com.epiccharts.twitter;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TwitterConfig {

    @Bean
    public SocialFeedClient socialFeedClient(TwitterProperties properties) {
        return new TwitterFeedClient(properties);
    }
}
