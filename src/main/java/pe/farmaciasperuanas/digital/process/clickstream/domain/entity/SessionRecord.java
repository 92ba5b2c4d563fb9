package pe.farmaciasperuanas.digital.process.clickstream.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * Registro de hecho: una sesión de visitante del dataset de clickstream.<br/>
 * <b>Copyright</b>: &copy; 2025 Digital.<br/>
 * <b>Company</b>: Digital.<br/>
 *
 * Los nombres de campo en MongoDB conservan las columnas originales de la carga
 * (administrative_duration, bouncerates, traffictype, ...).
 */
@Value
@Builder(toBuilder = true)
@AllArgsConstructor
@Document(collection = "shopper_data")
public class SessionRecord {
    @Id
    String id;

    int administrative;
    @Field("administrative_duration")
    double administrativeDuration;

    int informational;
    @Field("informational_duration")
    double informationalDuration;

    @Field("productrelated")
    int productRelated;
    @Field("productrelated_duration")
    double productRelatedDuration;

    @Field("bouncerates")
    double bounceRates;
    @Field("exitrates")
    double exitRates;
    @Field("pagevalues")
    double pageValues;
    @Field("specialday")
    double specialDay;

    String month;               // Feb, Mar, May, June, ...
    @Field("operatingsystems")
    Integer operatingSystem;    // Código en dim_os
    Integer browser;            // Código en dim_browser
    Integer region;             // Código en dim_region
    @Field("traffictype")
    Integer trafficType;        // Código en dim_traffic
    @Field("visitortype")
    String visitorType;         // Returning_Visitor, New_Visitor, Other

    boolean weekend;
    boolean revenue;            // true = sesión convertida
}
