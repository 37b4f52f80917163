package io.palaver.core.signal;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FlowSignalTest {

    @Test
    void signalsShouldNotCaptureStackTraces() {
        assertThat(new PromptSignal("Name?").getStackTrace()).isEmpty();
        assertThat(new TerminateSignal("Bye").getStackTrace()).isEmpty();
        assertThat(new RestartFlowSignal().getStackTrace()).isEmpty();
    }

    @Test
    void promptSignalShouldKeepChoiceOrderAndIgnoreLaterChanges() {
        Map<String, String> choices = new LinkedHashMap<>();
        choices.put("2", "Two");
        choices.put("1", "One");

        PromptSignal signal = new PromptSignal("Pick", choices, Media.image("https://x/y.png"));
        choices.put("3", "Three");

        assertThat(signal.getMessage()).isEqualTo("Pick");
        assertThat(signal.choices().keySet()).containsExactly("2", "1");
        assertThat(signal.media().type()).isEqualTo(MediaType.IMAGE);
    }

    @Test
    void mediaShouldDefaultToImage() {
        Media media = new Media(null, "https://x/doc.pdf", null);

        assertThat(media.type()).isEqualTo(MediaType.IMAGE);
        assertThat(MediaType.fromWire("document")).isEqualTo(MediaType.DOCUMENT);
        assertThat(MediaType.VIDEO.wireName()).isEqualTo("video");
    }
}
