package io.crosspost4j;

import java.util.List;

public interface PlatformPublisher {
    String platform();

    /**
     * @return platform-side reference of the created post
     */
    String publish(String text, List<String> media) throws Exception;
}
