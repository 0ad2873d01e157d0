package smartaqms.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada del motor de cómputo de calidad del aire.
 * <p>
 * Responsabilidades:
 * 1. Arrancar el contexto de Spring Boot (Web, JPA, Actuator).
 * 2. Verificar el contrato de esquema antes de aceptar tráfico ({@link smartaqms.compute.config.SchemaContractVerifier}).
 * 3. Lanzar los ciclos periódicos de detección y clasificación.
 */
@SpringBootApplication
public class AqmsEngineApplication {

    public static void main(String[] args) {
        // Cualquier opción se puede sobreescribir vía args: --aqms.detector.interval=PT15S
        SpringApplication.run(AqmsEngineApplication.class, args);
    }
}
