package senatesim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import senatesim.config.SenateRegistry;
import senatesim.config.SenatorLoader;
import senatesim.config.SimulationConfig;
import senatesim.debate.DebateListener;
import senatesim.debate.DebateManager;
import senatesim.display.EventJson;
import senatesim.display.LoggingDebateListener;
import senatesim.display.TranscriptStore;
import senatesim.speech.SpeechRecord;
import senatesim.speech.TemplateSpeechGenerator;
import senatesim.speech.TimeoutSpeechGenerator;

import java.util.List;
import java.util.Random;

public class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    SimulationConfig config = SimulationConfig.load();
    List<SenatorLoader.SenatorConfig> roster = new SenatorLoader().load(config.rosterPath());

    TranscriptStore transcript = new TranscriptStore();
    DebateListener listener = DebateListener.compose(transcript, new LoggingDebateListener());
    SenateRegistry senate = SenateRegistry.build(config, roster, listener);

    try (TimeoutSpeechGenerator generator = new TimeoutSpeechGenerator(
        new TemplateSpeechGenerator(new Random(config.seed())), config.generationTimeout())) {
      DebateManager manager = senate.newDebateManager(generator, listener);
      List<SpeechRecord> speeches = manager.conductDebate(config.topic(), senate.senators());
      log.info("[Senate] {} speeches delivered on {}", speeches.size(), config.topic());
    }

    for (String line : transcript.snapshotFrom(0).lines) {
      log.info("{}", line);
    }
    if (log.isDebugEnabled()) {
      senate.memorySnapshots().forEach((name, snapshot) ->
          log.debug("[Memory] {}: {}", name, EventJson.toJson(snapshot)));
    }
    if (senate.bus().handlerFailureCount() > 0) {
      log.warn("[Senate] {} handler failures during the debate", senate.bus().handlerFailureCount());
    }
  }
}
