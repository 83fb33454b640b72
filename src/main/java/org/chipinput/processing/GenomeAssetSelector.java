package org.chipinput.processing;

import org.chipinput.metrics.ErrorTag;
import org.chipinput.model.AssayType;
import org.chipinput.model.GenomeAssets;

import java.util.Map;
import java.util.Set;

/**
 * Reference genome, blacklists and aligner indices per species and assay category.
 */
public final class GenomeAssetSelector {

    public static final String HOMO_SAPIENS = "Homo sapiens";
    public static final String MUS_MUSCULUS = "Mus musculus";

    private static final String PORTAL = "https://www.encodeproject.org/files/";

    private static final String HG38_TSV = "https://storage.googleapis.com/encode-pipeline-genome-data/genome_tsv/v3/hg38.tsv";
    private static final String HG38_CHRSZ = PORTAL + "GRCh38_EBV.chrom.sizes/@@download/GRCh38_EBV.chrom.sizes.tsv";
    private static final String HG38_FA = PORTAL + "GRCh38_no_alt_analysis_set_GCA_000001405.15/@@download/GRCh38_no_alt_analysis_set_GCA_000001405.15.fasta.gz";
    private static final String HG38_BLACKLIST = download("ENCFF356LFX", "bed.gz");
    private static final String HG38_MINT_BLACKLIST2 = download("ENCFF023CZC", "bed.gz");
    private static final String HG38_BOWTIE2 = download("ENCFF110MCL", "tar.gz");
    private static final String HG38_BWA = download("ENCFF643CGH", "tar.gz");

    private static final String MM10_TSV = "https://storage.googleapis.com/encode-pipeline-genome-data/genome_tsv/v3/mm10.tsv";
    private static final String MM10_CHRSZ = PORTAL + "mm10_no_alt.chrom.sizes/@@download/mm10_no_alt.chrom.sizes.tsv";
    private static final String MM10_FA = PORTAL + "mm10_no_alt_analysis_set_ENCODE/@@download/mm10_no_alt_analysis_set_ENCODE.fasta.gz";
    private static final String MM10_BLACKLIST = download("ENCFF547MET", "bed.gz");
    private static final String MM10_BOWTIE2 = download("ENCFF309GLL", "tar.gz");

    private static final Map<String, GenomeAssets> MINT = Map.of(
            HOMO_SAPIENS, new GenomeAssets(HG38_TSV, HG38_CHRSZ, HG38_FA, HG38_BLACKLIST, HG38_MINT_BLACKLIST2, null, HG38_BWA),
            MUS_MUSCULUS, new GenomeAssets(MM10_TSV, MM10_CHRSZ, MM10_FA, null, null, null, null));

    private static final Map<String, GenomeAssets> STANDARD = Map.of(
            HOMO_SAPIENS, new GenomeAssets(HG38_TSV, HG38_CHRSZ, HG38_FA, HG38_BLACKLIST, null, HG38_BOWTIE2, null),
            MUS_MUSCULUS, new GenomeAssets(MM10_TSV, MM10_CHRSZ, MM10_FA, MM10_BLACKLIST, null, MM10_BOWTIE2, null));

    private GenomeAssetSelector() {
    }

    private static String download(String accession, String extension) {
        return PORTAL + accession + "/@@download/" + accession + "." + extension;
    }

    /**
     * @param organisms scientific names of all replicates' organisms; must name exactly one supported species
     */
    public static Resolution<GenomeAssets> select(String accession, Set<String> organisms, AssayType assay) {
        GenomeAssets assets = null;
        if (organisms.size() == 1) {
            String organism = organisms.iterator().next();
            assets = (assay.isMint() ? MINT : STANDARD).get(organism);
        }
        if (assets == null) {
            return Resolution.failure(accession, ErrorTag.UnsupportedOrganismOrAssay,
                    "No reference assets for organism(s) " + organisms + " and assay " + assay.title() + " in " + accession + ".");
        }
        return Resolution.success(assets);
    }
}
