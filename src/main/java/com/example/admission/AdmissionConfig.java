package com.example.admission;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.function.LongSupplier;

@Configuration
public class AdmissionConfig {

    // 補充の経過時間は壁時計ではなく単調時計で測る。テストでは差し替えて時間を進める
    @Bean
    public LongSupplier nanoTimeSource() {
        return System::nanoTime;
    }
}
