package com.condortrader;

import com.condortrader.domain.enums.TradingMode;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class CondorTraderApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(CondorTraderApplication.class, args);
        // a backtest is done once its runner returns; live trading runs until stopped
        String mode = context.getEnvironment().getProperty("condortrader.mode", TradingMode.LIVE.name());
        if (TradingMode.BACKTEST.name().equalsIgnoreCase(mode)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
