package com.nei10u.panchanga.model;

import static com.nei10u.panchanga.model.KaranaType.FIXED;
import static com.nei10u.panchanga.model.KaranaType.MOVABLE;
import static com.nei10u.panchanga.model.TithiGroup.BHADRA;
import static com.nei10u.panchanga.model.TithiGroup.JAYA;
import static com.nei10u.panchanga.model.TithiGroup.NANDA;
import static com.nei10u.panchanga.model.TithiGroup.PURNA;
import static com.nei10u.panchanga.model.TithiGroup.RIKTA;
import static com.nei10u.panchanga.model.YogaNature.AUSPICIOUS;
import static com.nei10u.panchanga.model.YogaNature.INAUSPICIOUS;
import static com.nei10u.panchanga.model.YogaNature.MIXED;

/**
 * 五支历法的静态数据表。
 */
public final class CalendarTables {

    private CalendarTables() {
    }

    public static final LookupTable<TithiName> TITHIS = LookupTable.of("tithi",
            new TithiName(1, "Pratipada", "प्रतिपदा", NANDA),
            new TithiName(2, "Dwitiya", "द्वितीया", BHADRA),
            new TithiName(3, "Tritiya", "तृतीया", JAYA),
            new TithiName(4, "Chaturthi", "चतुर्थी", RIKTA),
            new TithiName(5, "Panchami", "पञ्चमी", PURNA),
            new TithiName(6, "Shashthi", "षष्ठी", NANDA),
            new TithiName(7, "Saptami", "सप्तमी", BHADRA),
            new TithiName(8, "Ashtami", "अष्टमी", JAYA),
            new TithiName(9, "Navami", "नवमी", RIKTA),
            new TithiName(10, "Dashami", "दशमी", PURNA),
            new TithiName(11, "Ekadashi", "एकादशी", NANDA),
            new TithiName(12, "Dwadashi", "द्वादशी", BHADRA),
            new TithiName(13, "Trayodashi", "त्रयोदशी", JAYA),
            new TithiName(14, "Chaturdashi", "चतुर्दशी", RIKTA),
            new TithiName(15, "Purnima", "पूर्णिमा", PURNA),
            new TithiName(16, "Pratipada", "प्रतिपदा", NANDA),
            new TithiName(17, "Dwitiya", "द्वितीया", BHADRA),
            new TithiName(18, "Tritiya", "तृतीया", JAYA),
            new TithiName(19, "Chaturthi", "चतुर्थी", RIKTA),
            new TithiName(20, "Panchami", "पञ्चमी", PURNA),
            new TithiName(21, "Shashthi", "षष्ठी", NANDA),
            new TithiName(22, "Saptami", "सप्तमी", BHADRA),
            new TithiName(23, "Ashtami", "अष्टमी", JAYA),
            new TithiName(24, "Navami", "नवमी", RIKTA),
            new TithiName(25, "Dashami", "दशमी", PURNA),
            new TithiName(26, "Ekadashi", "एकादशी", NANDA),
            new TithiName(27, "Dwadashi", "द्वादशी", BHADRA),
            new TithiName(28, "Trayodashi", "त्रयोदशी", JAYA),
            new TithiName(29, "Chaturdashi", "चतुर्दशी", RIKTA),
            new TithiName(30, "Amavasya", "अमावस्या", PURNA));

    /**
     * 以 Tithi 在半月中的序号（1..15）为键。8 号是 Rahu，其余按七曜顺序循环两遍。
     */
    public static final LookupTable<Planet> TITHI_LORDS = LookupTable.of("tithi lord",
            Planet.SUN, Planet.MOON, Planet.MARS, Planet.MERCURY, Planet.JUPITER, Planet.VENUS, Planet.SATURN,
            Planet.RAHU,
            Planet.SUN, Planet.MOON, Planet.MARS, Planet.MERCURY, Planet.JUPITER, Planet.VENUS, Planet.SATURN);

    public static final LookupTable<NakshatraName> NAKSHATRAS = LookupTable.of("nakshatra",
            new NakshatraName(1, "Ashwini", Planet.KETU, "Ashwini Kumaras"),
            new NakshatraName(2, "Bharani", Planet.VENUS, "Yama"),
            new NakshatraName(3, "Krittika", Planet.SUN, "Agni"),
            new NakshatraName(4, "Rohini", Planet.MOON, "Brahma"),
            new NakshatraName(5, "Mrigashira", Planet.MARS, "Soma"),
            new NakshatraName(6, "Ardra", Planet.RAHU, "Rudra"),
            new NakshatraName(7, "Punarvasu", Planet.JUPITER, "Aditi"),
            new NakshatraName(8, "Pushya", Planet.SATURN, "Brihaspati"),
            new NakshatraName(9, "Ashlesha", Planet.MERCURY, "Sarpa"),
            new NakshatraName(10, "Magha", Planet.KETU, "Pitris"),
            new NakshatraName(11, "Purva Phalguni", Planet.VENUS, "Bhaga"),
            new NakshatraName(12, "Uttara Phalguni", Planet.SUN, "Aryaman"),
            new NakshatraName(13, "Hasta", Planet.MOON, "Savitar"),
            new NakshatraName(14, "Chitra", Planet.MARS, "Tvashtar"),
            new NakshatraName(15, "Swati", Planet.RAHU, "Vayu"),
            new NakshatraName(16, "Vishakha", Planet.JUPITER, "Indra-Agni"),
            new NakshatraName(17, "Anuradha", Planet.SATURN, "Mitra"),
            new NakshatraName(18, "Jyeshtha", Planet.MERCURY, "Indra"),
            new NakshatraName(19, "Mula", Planet.KETU, "Nirriti"),
            new NakshatraName(20, "Purva Ashadha", Planet.VENUS, "Apas"),
            new NakshatraName(21, "Uttara Ashadha", Planet.SUN, "Vishwadevas"),
            new NakshatraName(22, "Shravana", Planet.MOON, "Vishnu"),
            new NakshatraName(23, "Dhanishtha", Planet.MARS, "Vasus"),
            new NakshatraName(24, "Shatabhisha", Planet.RAHU, "Varuna"),
            new NakshatraName(25, "Purva Bhadrapada", Planet.JUPITER, "Aja Ekapada"),
            new NakshatraName(26, "Uttara Bhadrapada", Planet.SATURN, "Ahir Budhnya"),
            new NakshatraName(27, "Revati", Planet.MERCURY, "Pushan"));

    public static final LookupTable<YogaName> YOGAS = LookupTable.of("yoga",
            new YogaName(1, "Vishkumbha", "विष्कुम्भ", INAUSPICIOUS),
            new YogaName(2, "Priti", "प्रीति", AUSPICIOUS),
            new YogaName(3, "Ayushman", "आयुष्मान्", AUSPICIOUS),
            new YogaName(4, "Saubhagya", "सौभाग्य", AUSPICIOUS),
            new YogaName(5, "Shobhana", "शोभन", AUSPICIOUS),
            new YogaName(6, "Atiganda", "अतिगण्ड", INAUSPICIOUS),
            new YogaName(7, "Sukarma", "सुकर्म", AUSPICIOUS),
            new YogaName(8, "Dhriti", "धृति", AUSPICIOUS),
            new YogaName(9, "Shula", "शूल", INAUSPICIOUS),
            new YogaName(10, "Ganda", "गण्ड", INAUSPICIOUS),
            new YogaName(11, "Vriddhi", "वृद्धि", AUSPICIOUS),
            new YogaName(12, "Dhruva", "ध्रुव", AUSPICIOUS),
            new YogaName(13, "Vyaghata", "व्याघात", INAUSPICIOUS),
            new YogaName(14, "Harshana", "हर्षण", AUSPICIOUS),
            new YogaName(15, "Vajra", "वज्र", MIXED),
            new YogaName(16, "Siddhi", "सिद्धि", AUSPICIOUS),
            new YogaName(17, "Vyatipata", "व्यतीपात", INAUSPICIOUS),
            new YogaName(18, "Variyan", "वरीयान्", AUSPICIOUS),
            new YogaName(19, "Parigha", "परिघ", INAUSPICIOUS),
            new YogaName(20, "Shiva", "शिव", AUSPICIOUS),
            new YogaName(21, "Siddha", "सिद्ध", AUSPICIOUS),
            new YogaName(22, "Sadhya", "साध्य", AUSPICIOUS),
            new YogaName(23, "Shubha", "शुभ", AUSPICIOUS),
            new YogaName(24, "Shukla", "शुक्ल", AUSPICIOUS),
            new YogaName(25, "Brahma", "ब्रह्म", AUSPICIOUS),
            new YogaName(26, "Indra", "इन्द्र", AUSPICIOUS),
            new YogaName(27, "Vaidhriti", "वैधृति", INAUSPICIOUS));

    public static final KaranaName KIMSTUGHNA = new KaranaName("Kimstughna", "किंस्तुघ्न", FIXED);
    public static final KaranaName SHAKUNI = new KaranaName("Shakuni", "शकुनि", FIXED);
    public static final KaranaName CHATUSHPADA = new KaranaName("Chatushpada", "चतुष्पाद", FIXED);
    public static final KaranaName NAGA = new KaranaName("Naga", "नाग", FIXED);

    public static final LookupTable<KaranaName> MOVABLE_KARANAS = LookupTable.of("movable karana",
            new KaranaName("Bava", "बव", MOVABLE),
            new KaranaName("Balava", "बालव", MOVABLE),
            new KaranaName("Kaulava", "कौलव", MOVABLE),
            new KaranaName("Taitila", "तैतिल", MOVABLE),
            new KaranaName("Gara", "गर", MOVABLE),
            new KaranaName("Vanija", "वणिज", MOVABLE),
            new KaranaName("Vishti", "विष्टि", MOVABLE));

    /**
     * 周期末尾的三个固定 Karana，对应全局编号 58、59、60。
     */
    public static final LookupTable<KaranaName> TRAILING_FIXED_KARANAS = LookupTable.of("trailing fixed karana",
            SHAKUNI, CHATUSHPADA, NAGA);

    public static final LookupTable<VaraName> VARAS = LookupTable.of("vara",
            new VaraName(0, "Sunday", "रविवार", Planet.SUN),
            new VaraName(1, "Monday", "सोमवार", Planet.MOON),
            new VaraName(2, "Tuesday", "मंगलवार", Planet.MARS),
            new VaraName(3, "Wednesday", "बुधवार", Planet.MERCURY),
            new VaraName(4, "Thursday", "गुरुवार", Planet.JUPITER),
            new VaraName(5, "Friday", "शुक्रवार", Planet.VENUS),
            new VaraName(6, "Saturday", "शनिवार", Planet.SATURN));
}
