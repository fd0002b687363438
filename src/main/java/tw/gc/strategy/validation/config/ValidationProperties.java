package tw.gc.strategy.validation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.strategy.validation.enums.BootstrapMethod;

@Data
@Component
@ConfigurationProperties(prefix = "validation")
public class ValidationProperties {

    /**
     * Worker threads used for bootstrap replications and CSCV combinations.
     * 1 keeps everything on the calling thread.
     */
    private int parallelism = 1;

    private Random random = new Random();
    @Data
    public static class Random {
        private long seed = 123456789L;
    }

    private Bootstrap bootstrap = new Bootstrap();
    @Data
    public static class Bootstrap {
        private int replications = 2000;
        private int minReplications = 10;
        private BootstrapMethod method = BootstrapMethod.BCA;
    }

    private Cscv cscv = new Cscv();
    @Data
    public static class Cscv {
        private int blocks = 10;
    }

    private WalkForward walkForward = new WalkForward();
    @Data
    public static class WalkForward {
        private int trainBars = 2000;
        private int testBars = 1000;
    }
}
